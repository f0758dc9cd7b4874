package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TableChunker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Parser for CSV files: a column summary chunk followed by batches of rows. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvDocumentParser implements DocumentParser {

  private final TableChunker tableChunker;

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    String text = new String(content, StandardCharsets.UTF_8);
    TableChunker.Table table;
    try {
      table = tableChunker.readCsv(text);
    } catch (IOException | RuntimeException e) {
      log.error("CSV parsing failed for {}: {}", fileName, e.getMessage());
      throw new DocumentParseException(FileType.CSV, "Failed to parse CSV file", e);
    }

    List<ParsedChunk> chunks = new ArrayList<>();
    if (!table.columns().isEmpty()) {
      chunks.add(
          ParsedChunk.of(
              "Columns: " + String.join(", ", table.columns()), ChunkType.METADATA));
    }
    chunks.addAll(tableChunker.chunkRows(table, Map.of()));

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("columns", table.columns());
    metadata.put("rowCount", table.rows().size());
    return new ParsedDocument(text, metadata, chunks);
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.CSV);
  }
}
