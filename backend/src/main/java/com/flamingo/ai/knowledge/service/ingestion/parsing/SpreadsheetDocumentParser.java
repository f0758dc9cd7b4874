package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TableChunker;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

/**
 * Parser for Excel workbooks (XLSX and XLS) using Apache POI.
 *
 * <p>Each sheet yields a column summary chunk tagged with the sheet name, followed by row batches
 * in the same shape as CSV files. The first non-blank row of a sheet is its header.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpreadsheetDocumentParser implements DocumentParser {

  private final TableChunker tableChunker;

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
      DataFormatter formatter = new DataFormatter();
      List<ParsedChunk> chunks = new ArrayList<>();
      List<String> sheetNames = new ArrayList<>();
      List<String> sheetTexts = new ArrayList<>();

      for (Sheet sheet : workbook) {
        String sheetName = sheet.getSheetName();
        sheetNames.add(sheetName);
        TableChunker.Table table = readSheet(sheet, formatter);
        sheetTexts.add("Sheet: " + sheetName + "\n" + toCsv(table));

        String columns = table.columns().isEmpty() ? "none" : String.join(", ", table.columns());
        Map<String, Object> sheetMetadata = Map.of("sheetName", sheetName);
        chunks.add(
            ParsedChunk.of("Sheet \"" + sheetName + "\" - Columns: " + columns, ChunkType.METADATA)
                .withMetadata(sheetMetadata));
        chunks.addAll(tableChunker.chunkRows(table, sheetMetadata));
      }

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("sheetCount", sheetNames.size());
      metadata.put("sheetNames", sheetNames);
      return new ParsedDocument(String.join("\n\n", sheetTexts), metadata, chunks);
    } catch (IOException | RuntimeException e) {
      log.error("Excel parsing failed for {}: {}", fileName, e.getMessage());
      throw new DocumentParseException(fileType, "Failed to parse Excel file", e);
    }
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.XLSX, FileType.XLS);
  }

  private TableChunker.Table readSheet(Sheet sheet, DataFormatter formatter) {
    List<String> columns = null;
    List<List<String>> rows = new ArrayList<>();
    for (Row row : sheet) {
      List<String> values = readRow(row, formatter);
      if (values.stream().allMatch(String::isEmpty)) {
        continue;
      }
      if (columns == null) {
        columns = values;
      } else {
        rows.add(values);
      }
    }
    return new TableChunker.Table(columns == null ? List.of() : columns, rows);
  }

  private List<String> readRow(Row row, DataFormatter formatter) {
    List<String> values = new ArrayList<>();
    short lastCell = row.getLastCellNum();
    for (int c = 0; c < lastCell; c++) {
      Cell cell = row.getCell(c);
      values.add(cell == null ? "" : cellText(cell, formatter));
    }
    // trailing empty cells carry no data
    while (!values.isEmpty() && values.get(values.size() - 1).isEmpty()) {
      values.remove(values.size() - 1);
    }
    return values;
  }

  private String cellText(Cell cell, DataFormatter formatter) {
    if (cell.getCellType() != CellType.FORMULA) {
      return formatter.formatCellValue(cell);
    }
    return switch (cell.getCachedFormulaResultType()) {
      case NUMERIC -> formatter.formatRawCellContents(
          cell.getNumericCellValue(),
          cell.getCellStyle().getDataFormat(),
          cell.getCellStyle().getDataFormatString());
      case STRING -> cell.getStringCellValue();
      case BOOLEAN -> String.valueOf(cell.getBooleanCellValue()).toUpperCase();
      default -> "";
    };
  }

  private String toCsv(TableChunker.Table table) {
    StringBuilder csv = new StringBuilder();
    if (!table.columns().isEmpty()) {
      csv.append(csvLine(table.columns()));
    }
    for (List<String> row : table.rows()) {
      csv.append('\n').append(csvLine(row));
    }
    return csv.toString();
  }

  private static String csvLine(List<String> values) {
    List<String> quoted = new ArrayList<>(values.size());
    for (String value : values) {
      if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
        quoted.add('"' + value.replace("\"", "\"\"") + '"');
      } else {
        quoted.add(value);
      }
    }
    return String.join(",", quoted);
  }
}
