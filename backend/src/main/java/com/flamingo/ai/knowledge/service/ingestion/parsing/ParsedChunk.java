package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A chunk produced by a parser, before embedding.
 *
 * @param content chunk text
 * @param chunkType kind of content
 * @param sourcePage 1-based page or slide, when known
 * @param sourceLineStart 1-based first line, when known
 * @param sourceLineEnd 1-based last line, when known
 * @param metadata parser-specific attributes, never null
 */
public record ParsedChunk(
    String content,
    ChunkType chunkType,
    Integer sourcePage,
    Integer sourceLineStart,
    Integer sourceLineEnd,
    Map<String, Object> metadata) {

  public ParsedChunk {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static ParsedChunk of(String content, ChunkType chunkType) {
    return new ParsedChunk(content, chunkType, null, null, null, Map.of());
  }

  public static ParsedChunk lines(
      String content, ChunkType chunkType, int lineStart, int lineEnd) {
    return new ParsedChunk(content, chunkType, null, lineStart, lineEnd, Map.of());
  }

  public ParsedChunk withPage(int page) {
    return new ParsedChunk(content, chunkType, page, sourceLineStart, sourceLineEnd, metadata);
  }

  public ParsedChunk withContent(String newContent) {
    return new ParsedChunk(
        newContent, chunkType, sourcePage, sourceLineStart, sourceLineEnd, metadata);
  }

  /** Returns a copy with the given entries added to the metadata. */
  public ParsedChunk withMetadata(Map<String, Object> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.putAll(extra);
    return new ParsedChunk(content, chunkType, sourcePage, sourceLineStart, sourceLineEnd, merged);
  }
}
