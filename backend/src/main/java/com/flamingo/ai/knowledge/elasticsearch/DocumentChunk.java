package com.flamingo.ai.knowledge.elasticsearch;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A searchable slice of a document, stored in Elasticsearch with its optional embedding.
 *
 * <p>The id is {@code {documentId}_{chunkIndex}}, so reindexing a document overwrites rather than
 * duplicates its chunks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk implements ScoredDocument {

  private String id;
  private UUID documentId;
  private int chunkIndex;
  private String content;
  private ChunkType chunkType;
  private Integer sourcePage;
  private Integer sourceLineStart;
  private Integer sourceLineEnd;

  /** Null when embedding failed for this chunk; such chunks are only found by keyword search. */
  private List<Float> embedding;

  private int tokenCount;
  @Builder.Default private Map<String, Object> metadata = Map.of();

  // Relevance score from search results (set by search methods)
  @Builder.Default private Double relevanceScore = 0.0;

  public static String chunkId(UUID documentId, int chunkIndex) {
    return documentId + "_" + chunkIndex;
  }
}
