package com.flamingo.ai.knowledge.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

class OfficeDocumentParserTest {

  private final OfficeDocumentParser parser =
      new OfficeDocumentParser(new TextChunker(new KnowledgeConfig()));

  @Test
  void shouldExtractDocxText() throws IOException {
    byte[] docx;
    try (XWPFDocument document = new XWPFDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      document.createParagraph().createRun().setText("Meeting notes");
      document.createParagraph().createRun().setText("Action items follow.");
      document.write(out);
      docx = out.toByteArray();
    }

    ParsedDocument parsed = parser.parse(docx, FileType.DOCX, "notes.docx");

    assertThat(parsed.content()).contains("Meeting notes").contains("Action items follow.");
    assertThat(parsed.chunks()).hasSize(1);
  }

  @Test
  void shouldSupportWordAndLegacyPowerPoint() {
    assertThat(parser.supportedTypes())
        .containsExactlyInAnyOrder(FileType.DOCX, FileType.DOC, FileType.PPT);
  }

  @Test
  void shouldNameActualType_whenLegacyWordDocumentIsCorrupt() {
    // Given - an OLE2 signature with the rest of the container missing
    byte[] truncated = {
      (byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1
    };

    // When / Then
    assertThatThrownBy(() -> parser.parse(truncated, FileType.DOC, "minutes.doc"))
        .isInstanceOf(DocumentParseException.class)
        .hasMessage("Failed to parse DOC document")
        .extracting(e -> ((DocumentParseException) e).getFileType())
        .isEqualTo(FileType.DOC);
  }
}
