package com.flamingo.ai.knowledge.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class CodeDocumentParserTest {

  private final CodeDocumentParser parser = new CodeDocumentParser(new KnowledgeConfig());

  @Test
  void shouldSplitAtDeclarationOnceEnoughLines() {
    String code =
        String.join(
            "\n",
            "import os",
            "x = 1",
            "y = 2",
            "z = 3",
            "w = 4",
            "def foo():",
            "    return 1",
            "def bar():",
            "    return 2");

    ParsedDocument parsed =
        parser.parse(code.getBytes(StandardCharsets.UTF_8), FileType.CODE, "script.py");

    assertThat(parsed.chunks()).hasSize(2);
    ParsedChunk first = parsed.chunks().get(0);
    assertThat(first.chunkType()).isEqualTo(ChunkType.CODE);
    assertThat(first.sourceLineStart()).isEqualTo(1);
    assertThat(first.sourceLineEnd()).isEqualTo(5);
    ParsedChunk second = parsed.chunks().get(1);
    assertThat(second.content()).startsWith("def foo():").contains("def bar():");
    assertThat(second.sourceLineStart()).isEqualTo(6);
    assertThat(second.sourceLineEnd()).isEqualTo(9);
    assertThat(parsed.metadata())
        .containsEntry("language", "py")
        .containsEntry("lineCount", 9)
        .containsEntry("fileName", "script.py");
  }

  @Test
  void shouldFlushChunkThatOutgrowsSize() {
    KnowledgeConfig config = new KnowledgeConfig();
    config.getChunking().setCodeChunkSize(20);
    CodeDocumentParser small = new CodeDocumentParser(config);
    String code = "aaaaaaaaaa\nbbbbbbbbbb\ncccccccccc\ndddddddddd";

    ParsedDocument parsed =
        small.parse(code.getBytes(StandardCharsets.UTF_8), FileType.CODE, "data.sql");

    // two lines of ten characters already exceed 20
    assertThat(parsed.chunks()).hasSize(2);
    assertThat(parsed.chunks().get(0).content()).isEqualTo("aaaaaaaaaa\nbbbbbbbbbb");
    assertThat(parsed.chunks().get(0).sourceLineEnd()).isEqualTo(2);
    assertThat(parsed.chunks().get(1).sourceLineStart()).isEqualTo(3);
    assertThat(parsed.chunks().get(1).sourceLineEnd()).isEqualTo(4);
  }

  @Test
  void shouldRecognizeCommonDeclarations() {
    assertThat(CodeDocumentParser.isBoundary("export async function load() {")).isTrue();
    assertThat(CodeDocumentParser.isBoundary("func main() {")).isTrue();
    assertThat(CodeDocumentParser.isBoundary("pub fn run() {")).isTrue();
    assertThat(CodeDocumentParser.isBoundary("public static void main(String[] args) {"))
        .isTrue();
    assertThat(CodeDocumentParser.isBoundary("x = 1")).isFalse();
  }
}
