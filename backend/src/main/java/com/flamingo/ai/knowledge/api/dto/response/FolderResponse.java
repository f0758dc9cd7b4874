package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for folder data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FolderResponse {

  private UUID id;
  private String name;
  private UUID parentId;
  private String color;
  private long documentCount;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a FolderResponse from a DocumentFolder entity. */
  public static FolderResponse fromEntity(DocumentFolder folder, long documentCount) {
    return FolderResponse.builder()
        .id(folder.getId())
        .name(folder.getName())
        .parentId(folder.getParentId())
        .color(folder.getColor())
        .documentCount(documentCount)
        .createdAt(folder.getCreatedAt())
        .updatedAt(folder.getUpdatedAt())
        .build();
  }
}
