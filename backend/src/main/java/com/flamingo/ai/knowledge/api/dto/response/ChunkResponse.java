package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunk;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String id;
  private int chunkIndex;
  private String content;
  private ChunkType chunkType;
  private Integer sourcePage;
  private Integer sourceLineStart;
  private Integer sourceLineEnd;
  private int tokenCount;
  private Map<String, Object> metadata;

  public static ChunkResponse fromChunk(DocumentChunk chunk) {
    return ChunkResponse.builder()
        .id(chunk.getId())
        .chunkIndex(chunk.getChunkIndex())
        .content(chunk.getContent())
        .chunkType(chunk.getChunkType())
        .sourcePage(chunk.getSourcePage())
        .sourceLineStart(chunk.getSourceLineStart())
        .sourceLineEnd(chunk.getSourceLineEnd())
        .tokenCount(chunk.getTokenCount())
        .metadata(chunk.getMetadata())
        .build();
  }
}
