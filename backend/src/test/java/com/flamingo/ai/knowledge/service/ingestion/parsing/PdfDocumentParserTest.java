package com.flamingo.ai.knowledge.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

class PdfDocumentParserTest {

  private final PdfDocumentParser parser =
      new PdfDocumentParser(new TextChunker(new KnowledgeConfig()));

  @Test
  void shouldExtractTextAndDocumentInfo() throws IOException {
    byte[] pdf = pdf("Quarterly revenue grew", "Costs were flat");

    ParsedDocument parsed = parser.parse(pdf, FileType.PDF, "report.pdf");

    assertThat(parsed.content()).contains("Quarterly revenue grew").contains("Costs were flat");
    assertThat(parsed.chunks()).isNotEmpty();
    assertThat(parsed.chunks().get(0).sourcePage()).isEqualTo(1);
    assertThat(parsed.metadata()).containsEntry("pages", 2);
    assertThat(parsed.metadata().get("info")).asInstanceOf(MAP).containsEntry("title", "Report");
  }

  @Test
  void shouldFailOnCorruptedPdf() {
    byte[] corrupted = "%PDF-1.7\nthis is not really a pdf".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> parser.parse(corrupted, FileType.PDF, "broken.pdf"))
        .isInstanceOf(DocumentParseException.class)
        .hasMessage("Failed to parse PDF document");
  }

  private static byte[] pdf(String... pageTexts) throws IOException {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (String text : pageTexts) {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
          stream.beginText();
          stream.setFont(font, 12);
          stream.newLineAtOffset(72, 700);
          stream.showText(text);
          stream.endText();
        }
      }
      document.getDocumentInformation().setTitle("Report");
      document.save(out);
      return out.toByteArray();
    }
  }
}
