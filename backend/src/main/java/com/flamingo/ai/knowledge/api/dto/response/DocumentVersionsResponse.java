package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Version history of a document, newest first. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentVersionsResponse {

  private UUID rootDocumentId;
  private List<Version> versions;

  /** Summary of one version. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Version {
    private UUID id;
    private String name;
    private Integer version;
    private Boolean latest;
    private Long sizeBytes;
    private DocumentStatus status;
    private LocalDateTime createdAt;
  }

  public static DocumentVersionsResponse from(UUID rootDocumentId, List<Document> documents) {
    return DocumentVersionsResponse.builder()
        .rootDocumentId(rootDocumentId)
        .versions(
            documents.stream()
                .map(
                    d ->
                        Version.builder()
                            .id(d.getId())
                            .name(d.getName())
                            .version(d.getVersion())
                            .latest(d.getLatest())
                            .sizeBytes(d.getSizeBytes())
                            .status(d.getStatus())
                            .createdAt(d.getCreatedAt())
                            .build())
                .toList())
        .build();
  }
}
