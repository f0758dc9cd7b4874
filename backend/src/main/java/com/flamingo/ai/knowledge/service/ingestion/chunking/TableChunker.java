package com.flamingo.ai.knowledge.service.ingestion.chunking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.service.ingestion.parsing.ParsedChunk;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Groups tabular rows into {@link ChunkType#TABLE} chunks.
 *
 * <p>Every chunk holds up to {@code rowsPerChunk} rows, one JSON object per line keyed by column
 * name. Line numbers count the header as line 1, so the first data row is line 2.
 */
@Component
public class TableChunker {

  private static final ObjectMapper JSON = new ObjectMapper();

  private final CsvMapper csvMapper = new CsvMapper();
  private final KnowledgeConfig.Chunking config;

  public TableChunker(KnowledgeConfig knowledgeConfig) {
    this.config = knowledgeConfig.getChunking();
  }

  /** Header and data rows of a table. */
  public record Table(List<String> columns, List<List<String>> rows) {}

  /**
   * Reads CSV text. The first non-empty record is the header; empty lines are skipped.
   *
   * @throws IOException if the text is not valid CSV
   */
  public Table readCsv(String csv) throws IOException {
    List<String> columns = List.of();
    List<List<String>> rows = new ArrayList<>();
    try (MappingIterator<String[]> records =
        csvMapper
            .readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES)
            .readValues(csv)) {
      boolean header = true;
      while (records.hasNextValue()) {
        String[] record = records.nextValue();
        if (header) {
          columns = Arrays.asList(record);
          header = false;
        } else {
          rows.add(Arrays.asList(record));
        }
      }
    }
    return new Table(columns, rows);
  }

  public List<ParsedChunk> chunkRows(Table table, Map<String, Object> chunkMetadata) {
    List<ParsedChunk> chunks = new ArrayList<>();
    int rowsPerChunk = config.getRowsPerChunk();
    int total = table.rows().size();
    for (int i = 0; i < total; i += rowsPerChunk) {
      int end = Math.min(i + rowsPerChunk, total);
      List<String> lines = new ArrayList<>(end - i);
      for (List<String> row : table.rows().subList(i, end)) {
        lines.add(toJson(table.columns(), row));
      }
      chunks.add(
          ParsedChunk.lines(String.join("\n", lines), ChunkType.TABLE, i + 2, end + 1)
              .withMetadata(chunkMetadata));
    }
    return chunks;
  }

  private String toJson(List<String> columns, List<String> row) {
    Map<String, String> object = new LinkedHashMap<>();
    for (int c = 0; c < row.size(); c++) {
      String column = c < columns.size() ? columns.get(c) : "column_" + (c + 1);
      object.put(column, row.get(c));
    }
    try {
      return JSON.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize table row", e);
    }
  }
}
