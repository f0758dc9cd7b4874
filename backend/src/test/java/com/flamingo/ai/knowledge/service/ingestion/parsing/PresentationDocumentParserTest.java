package com.flamingo.ai.knowledge.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.Test;

class PresentationDocumentParserTest {

  private final PresentationDocumentParser parser =
      new PresentationDocumentParser(new TextChunker(new KnowledgeConfig()));

  @Test
  void shouldEmitOneChunkPerSlideInNumericOrder() throws IOException {
    byte[] deck;
    try (ByteArrayOutputStream out = new ByteArrayOutputStream();
        ZipOutputStream zip = new ZipOutputStream(out)) {
      entry(zip, "[Content_Types].xml", "<Types/>");
      entry(zip, "ppt/slides/slide10.xml", slide("Closing", "Thanks"));
      entry(zip, "ppt/slides/slide2.xml", slide("Agenda"));
      entry(zip, "ppt/slides/slide1.xml", slide("Welcome", "Quarterly review"));
      entry(zip, "ppt/slides/_rels/slide1.xml.rels", "<Relationships/>");
      zip.finish();
      deck = out.toByteArray();
    }

    ParsedDocument parsed = parser.parse(deck, FileType.PPTX, "deck.pptx");

    assertThat(parsed.chunks()).hasSize(3);
    assertThat(parsed.chunks().get(0).content()).isEqualTo("Slide 1:\nWelcome\nQuarterly review");
    assertThat(parsed.chunks().get(0).sourcePage()).isEqualTo(1);
    assertThat(parsed.chunks().get(2).content()).isEqualTo("Slide 3:\nClosing\nThanks");
    assertThat(parsed.metadata()).containsEntry("slideCount", 3);
    assertThat(parsed.content()).startsWith("Slide 1: Welcome Quarterly review\n\nSlide 2: Agenda");
  }

  @Test
  void shouldRejectNonZipContent() {
    byte[] content = "plain text".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> parser.parse(content, FileType.PPTX, "fake.pptx"))
        .isInstanceOf(DocumentParseException.class)
        .hasMessage("Failed to parse PPTX presentation");
  }

  private static String slide(String... texts) {
    StringBuilder xml =
        new StringBuilder(
            "<p:sld xmlns:p=\"http://schemas.openxmlformats.org/presentationml/2006/main\""
                + " xmlns:a=\"http://schemas.openxmlformats.org/drawingml/2006/main\">"
                + "<p:cSld><p:spTree>");
    for (String text : texts) {
      xml.append("<p:sp><p:txBody><a:p><a:r><a:t>")
          .append(text)
          .append("</a:t></a:r></a:p></p:txBody></p:sp>");
    }
    return xml.append("</p:spTree></p:cSld></p:sld>").toString();
  }

  private static void entry(ZipOutputStream zip, String name, String content)
      throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(content.getBytes(StandardCharsets.UTF_8));
    zip.closeEntry();
  }
}
