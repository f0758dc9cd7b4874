package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String name;
  private String originalName;
  private String mimeType;
  private Long sizeBytes;
  private FileType fileType;
  private DocumentStatus status;
  private DocumentScope scope;
  private String threadId;
  private UUID folderId;
  private Integer chunkCount;
  private Integer tokenCount;
  private Map<String, Object> metadata;
  private UUID parentDocumentId;
  private Integer version;
  private Boolean latest;
  private String processingError;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .name(document.getName())
        .originalName(document.getOriginalName())
        .mimeType(document.getMimeType())
        .sizeBytes(document.getSizeBytes())
        .fileType(document.getFileType())
        .status(document.getStatus())
        .scope(document.getScope())
        .threadId(document.getThreadId())
        .folderId(document.getFolderId())
        .chunkCount(document.getChunkCount())
        .tokenCount(document.getTokenCount())
        .metadata(document.getMetadata())
        .parentDocumentId(document.getParentDocumentId())
        .version(document.getVersion())
        .latest(document.getLatest())
        .processingError(document.getProcessingError())
        .createdAt(document.getCreatedAt())
        .updatedAt(document.getUpdatedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
