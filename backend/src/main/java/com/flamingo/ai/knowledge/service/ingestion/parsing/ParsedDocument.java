package com.flamingo.ai.knowledge.service.ingestion.parsing;

import java.util.List;
import java.util.Map;

/**
 * Normalized parser output.
 *
 * @param content full extracted text
 * @param metadata document-level attributes stored on the document record
 * @param chunks ordered chunks; may be empty
 */
public record ParsedDocument(
    String content, Map<String, Object> metadata, List<ParsedChunk> chunks) {

  public ParsedDocument {
    content = content == null ? "" : content;
    metadata = metadata == null ? Map.of() : metadata;
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }
}
