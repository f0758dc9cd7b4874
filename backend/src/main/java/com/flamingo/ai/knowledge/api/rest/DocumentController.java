package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.request.BulkDocumentRequest;
import com.flamingo.ai.knowledge.api.dto.request.MoveDocumentRequest;
import com.flamingo.ai.knowledge.api.dto.response.BulkOperationResponse;
import com.flamingo.ai.knowledge.api.dto.response.DocumentDetailResponse;
import com.flamingo.ai.knowledge.api.dto.response.DocumentListResponse;
import com.flamingo.ai.knowledge.api.dto.response.DocumentResponse;
import com.flamingo.ai.knowledge.api.dto.response.DocumentVersionsResponse;
import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.service.document.DocumentListQuery;
import com.flamingo.ai.knowledge.service.document.DocumentService;
import com.flamingo.ai.knowledge.service.document.UploadOptions;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document management. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  static final String ROOT_FOLDER = "root";

  private final DocumentService documentService;

  /** Uploads a document; processing continues in the background. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "scope", required = false) DocumentScope scope,
      @RequestParam(value = "threadId", required = false) String threadId,
      @RequestParam(value = "name", required = false) String name,
      @RequestParam(value = "folderId", required = false) UUID folderId) {
    Document document =
        documentService.uploadDocument(
            userId, file, new UploadOptions(scope, threadId, name, folderId));
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Lists documents. {@code folderId=root} lists documents outside any folder. */
  @GetMapping
  public ResponseEntity<DocumentListResponse> listDocuments(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @RequestParam(value = "scope", required = false) DocumentScope scope,
      @RequestParam(value = "threadId", required = false) String threadId,
      @RequestParam(value = "status", required = false) DocumentStatus status,
      @RequestParam(value = "folderId", required = false) String folderId,
      @RequestParam(value = "limit", defaultValue = "50") int limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset,
      @RequestParam(value = "orderBy", defaultValue = "created_at") String orderBy,
      @RequestParam(value = "orderDirection", defaultValue = "desc") String orderDirection) {
    boolean rootOnly = ROOT_FOLDER.equalsIgnoreCase(folderId);
    DocumentListQuery query =
        DocumentListQuery.builder()
            .scope(scope)
            .threadId(threadId)
            .status(status)
            .folderId(folderId != null && !rootOnly ? UUID.fromString(folderId) : null)
            .rootOnly(rootOnly)
            .limit(limit)
            .offset(offset)
            .orderBy(orderBy)
            .orderDirection(orderDirection)
            .build();
    Page<Document> page = documentService.listDocuments(userId, query);
    return ResponseEntity.ok(
        DocumentListResponse.builder()
            .documents(page.getContent().stream().map(DocumentResponse::fromEntity).toList())
            .total(page.getTotalElements())
            .limit(page.getSize())
            .offset(page.getPageable().getOffset())
            .build());
  }

  /** Gets a document with its chunks. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentDetailResponse> getDocument(
      @RequestHeader(ApiHeaders.USER_ID) String userId, @PathVariable UUID documentId) {
    return ResponseEntity.ok(
        DocumentDetailResponse.from(documentService.getDocumentWithChunks(userId, documentId)));
  }

  /** Deletes a document. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(
      @RequestHeader(ApiHeaders.USER_ID) String userId, @PathVariable UUID documentId) {
    documentService.deleteDocument(userId, documentId);
    return ResponseEntity.noContent().build();
  }

  /** Lists the version history of a document. */
  @GetMapping("/{documentId}/versions")
  public ResponseEntity<DocumentVersionsResponse> listVersions(
      @RequestHeader(ApiHeaders.USER_ID) String userId, @PathVariable UUID documentId) {
    List<Document> versions = documentService.listVersions(userId, documentId);
    UUID rootId = versions.isEmpty() ? documentId : versions.get(0).versionRootId();
    return ResponseEntity.ok(DocumentVersionsResponse.from(rootId, versions));
  }

  /** Uploads a new version of a document. */
  @PostMapping(value = "/{documentId}/versions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadVersion(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @PathVariable UUID documentId,
      @RequestParam("file") MultipartFile file) {
    Document document = documentService.uploadVersion(userId, documentId, file);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Schedules reprocessing of a document. */
  @PostMapping("/{documentId}/process")
  public ResponseEntity<DocumentResponse> processDocument(
      @RequestHeader(ApiHeaders.USER_ID) String userId, @PathVariable UUID documentId) {
    Document document = documentService.reprocessDocument(userId, documentId);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(DocumentResponse.fromEntity(document));
  }

  /** Moves a document into a folder, or to the root. */
  @PutMapping("/{documentId}/folder")
  public ResponseEntity<DocumentResponse> moveDocument(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @PathVariable UUID documentId,
      @RequestBody MoveDocumentRequest request) {
    Document document = documentService.moveToFolder(userId, documentId, request.getFolderId());
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }

  /** Archives a document. */
  @PostMapping("/{documentId}/archive")
  public ResponseEntity<DocumentResponse> archiveDocument(
      @RequestHeader(ApiHeaders.USER_ID) String userId, @PathVariable UUID documentId) {
    return ResponseEntity.ok(
        DocumentResponse.fromEntity(documentService.archiveDocument(userId, documentId)));
  }

  /** Deletes or moves several documents. */
  @PostMapping("/bulk")
  public ResponseEntity<BulkOperationResponse> bulk(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @Valid @RequestBody BulkDocumentRequest request) {
    int affected =
        switch (request.getAction()) {
          case DELETE -> documentService.bulkDelete(userId, request.getDocumentIds());
          case MOVE ->
              documentService.bulkMove(userId, request.getDocumentIds(), request.getFolderId());
        };
    return ResponseEntity.ok(
        BulkOperationResponse.builder()
            .action(request.getAction())
            .requested(request.getDocumentIds().size())
            .affected(affected)
            .build());
  }
}
