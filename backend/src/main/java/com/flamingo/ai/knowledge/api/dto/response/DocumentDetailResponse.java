package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.service.document.DocumentWithChunks;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document with its chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentDetailResponse {

  private DocumentResponse document;
  private List<ChunkResponse> chunks;

  public static DocumentDetailResponse from(DocumentWithChunks documentWithChunks) {
    return DocumentDetailResponse.builder()
        .document(DocumentResponse.fromEntity(documentWithChunks.document()))
        .chunks(documentWithChunks.chunks().stream().map(ChunkResponse::fromChunk).toList())
        .build();
  }
}
