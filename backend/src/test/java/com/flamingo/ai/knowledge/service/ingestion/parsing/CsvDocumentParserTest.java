package com.flamingo.ai.knowledge.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TableChunker;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class CsvDocumentParserTest {

  private final CsvDocumentParser parser =
      new CsvDocumentParser(new TableChunker(new KnowledgeConfig()));

  @Test
  void shouldEmitColumnSummaryAndRowChunk() {
    String csv = "name,age\nalice,30\n\nbob,25\n";

    ParsedDocument parsed = parser.parse(bytes(csv), FileType.CSV, "people.csv");

    assertThat(parsed.chunks()).hasSize(2);
    ParsedChunk summary = parsed.chunks().get(0);
    assertThat(summary.chunkType()).isEqualTo(ChunkType.METADATA);
    assertThat(summary.content()).isEqualTo("Columns: name, age");

    ParsedChunk rows = parsed.chunks().get(1);
    assertThat(rows.chunkType()).isEqualTo(ChunkType.TABLE);
    assertThat(rows.content())
        .isEqualTo("{\"name\":\"alice\",\"age\":\"30\"}\n{\"name\":\"bob\",\"age\":\"25\"}");
    assertThat(rows.sourceLineStart()).isEqualTo(2);
    assertThat(rows.sourceLineEnd()).isEqualTo(3);

    assertThat(parsed.metadata())
        .containsEntry("columns", List.of("name", "age"))
        .containsEntry("rowCount", 2);
  }

  @Test
  void shouldBatchRowsByConfiguredSize() {
    StringBuilder csv = new StringBuilder("id,value");
    for (int i = 1; i <= 45; i++) {
      csv.append('\n').append(i).append(",v").append(i);
    }

    ParsedDocument parsed = parser.parse(bytes(csv.toString()), FileType.CSV, "big.csv");

    assertThat(parsed.chunks()).hasSize(4);
    ParsedChunk last = parsed.chunks().get(3);
    assertThat(last.sourceLineStart()).isEqualTo(42);
    assertThat(last.sourceLineEnd()).isEqualTo(46);
    assertThat(last.content().split("\n")).hasSize(5);
  }

  @Test
  void shouldFailOnMalformedQuoting() {
    String csv = "name,comment\nalice,\"unterminated";

    assertThatThrownBy(() -> parser.parse(bytes(csv), FileType.CSV, "broken.csv"))
        .isInstanceOf(DocumentParseException.class)
        .hasMessage("Failed to parse CSV file");
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
