package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.converter.JsonMapConverter;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** An uploaded file in a user's knowledge base. */
@Entity
@Table(
    name = "documents",
    indexes = {
      @Index(name = "idx_documents_user_status", columnList = "user_id, status"),
      @Index(name = "idx_documents_folder", columnList = "folder_id"),
      @Index(name = "idx_documents_hash", columnList = "user_id, content_hash"),
      @Index(name = "idx_documents_parent", columnList = "parent_document_id")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  /** Display name. */
  @Column(nullable = false)
  private String name;

  @Column(nullable = false)
  private String originalName;

  @Column(nullable = false)
  private String mimeType;

  private Long sizeBytes;

  @Column(nullable = false)
  private String storagePath;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private FileType fileType;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentScope scope = DocumentScope.GLOBAL;

  /** Conversation the document is attached to, for conversation scope. */
  private String threadId;

  @Column(name = "folder_id")
  private UUID folderId;

  /** SHA-256 of the uploaded bytes, used to reject duplicate uploads. */
  @Column(name = "content_hash")
  private String contentHash;

  /** First version of the chain this document belongs to; null when it is the first version. */
  @Column(name = "parent_document_id")
  private UUID parentDocumentId;

  @Column(nullable = false)
  @Builder.Default
  private Integer version = 1;

  @Column(name = "is_latest", nullable = false)
  @Builder.Default
  private Boolean latest = true;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> metadata = new LinkedHashMap<>();

  @Builder.Default private Integer chunkCount = 0;

  @Builder.Default private Integer tokenCount = 0;

  /** Error message if processing failed. */
  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /**
   * Enters the processing state. Allowed from any state but archived, so ready and failed
   * documents can be reprocessed.
   */
  public void startProcessing() {
    if (status == DocumentStatus.ARCHIVED) {
      throw new IllegalStateException("Archived document " + id + " cannot be processed");
    }
    this.status = DocumentStatus.PROCESSING;
    this.processingError = null;
  }

  /** Marks the document as successfully processed. */
  public void markReady(int chunkCount, int tokenCount, Map<String, Object> metadata) {
    if (status != DocumentStatus.PROCESSING) {
      throw new IllegalStateException(
          "Document " + id + " must be processing to become ready, but is " + status);
    }
    this.status = DocumentStatus.READY;
    this.chunkCount = chunkCount;
    this.tokenCount = tokenCount;
    this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. Archived documents stay archived. */
  public void markFailed(String errorMessage) {
    if (status != DocumentStatus.ARCHIVED) {
      this.status = DocumentStatus.ERROR;
    }
    this.processingError = errorMessage;
    this.chunkCount = 0;
    this.tokenCount = 0;
    this.processedAt = LocalDateTime.now();
  }

  /** Hides the document from listings and search. */
  public void archive() {
    this.status = DocumentStatus.ARCHIVED;
  }

  /** Id shared by every version of this document: the id of the first version. */
  public UUID versionRootId() {
    return parentDocumentId != null ? parentDocumentId : id;
  }

  public boolean isOwnedBy(String candidateUserId) {
    return userId != null && userId.equals(candidateUserId);
  }
}
