package com.flamingo.ai.knowledge.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TableChunker;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class SpreadsheetDocumentParserTest {

  private final SpreadsheetDocumentParser parser =
      new SpreadsheetDocumentParser(new TableChunker(new KnowledgeConfig()));

  @Test
  void shouldEmitSummaryAndRowBatchesPerSheet() throws IOException {
    byte[] workbook = workbook();

    ParsedDocument parsed = parser.parse(workbook, FileType.XLSX, "report.xlsx");

    List<ParsedChunk> chunks = parsed.chunks();
    assertThat(chunks).hasSize(7);
    assertThat(chunks).filteredOn(c -> c.chunkType() == ChunkType.METADATA).hasSize(3);
    assertThat(chunks).filteredOn(c -> c.chunkType() == ChunkType.TABLE).hasSize(4);

    assertThat(chunks.get(0).content()).isEqualTo("Sheet \"Sales\" - Columns: region, amount");
    assertThat(chunks.get(3).sourceLineStart()).isEqualTo(42);
    assertThat(chunks.get(3).sourceLineEnd()).isEqualTo(46);
    assertThat(chunks.get(3).metadata()).containsEntry("sheetName", "Sales");
    assertThat(chunks.get(6).content()).isEqualTo("Sheet \"Empty\" - Columns: none");

    assertThat(parsed.metadata())
        .containsEntry("sheetCount", 3)
        .containsEntry("sheetNames", List.of("Sales", "Costs", "Empty"));
    assertThat(parsed.content()).startsWith("Sheet: Sales\nregion,amount\nnorth,1");
  }

  @Test
  void shouldRejectBytesThatAreNotAWorkbook() {
    byte[] content = "not a workbook".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> parser.parse(content, FileType.XLSX, "fake.xlsx"))
        .isInstanceOf(DocumentParseException.class)
        .hasMessage("Failed to parse Excel file");
  }

  private static byte[] workbook() throws IOException {
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      fill(workbook.createSheet("Sales"), 45);
      fill(workbook.createSheet("Costs"), 10);
      workbook.createSheet("Empty");
      workbook.write(out);
      return out.toByteArray();
    }
  }

  private static void fill(Sheet sheet, int rows) {
    Row header = sheet.createRow(0);
    header.createCell(0).setCellValue("region");
    header.createCell(1).setCellValue("amount");
    for (int i = 1; i <= rows; i++) {
      Row row = sheet.createRow(i);
      row.createCell(0).setCellValue("north");
      row.createCell(1).setCellValue(i);
    }
  }
}
