package com.flamingo.ai.knowledge.service.document;

import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.atRoot;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.hasScope;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.hasStatus;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.inFolder;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.inThread;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.notArchived;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.ownedBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.domain.repository.DocumentFolderRepository;
import com.flamingo.ai.knowledge.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledge.domain.repository.OffsetPageRequest;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunk;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.exception.DuplicateDocumentException;
import com.flamingo.ai.knowledge.exception.FileValidationException;
import com.flamingo.ai.knowledge.exception.FolderNotFoundException;
import com.flamingo.ai.knowledge.exception.MimeTypeRejectedException;
import com.flamingo.ai.knowledge.exception.UnsupportedFileTypeException;
import com.flamingo.ai.knowledge.service.folder.FolderService;
import com.flamingo.ai.knowledge.service.ingestion.DocumentProcessingQueue;
import com.flamingo.ai.knowledge.service.ingestion.FileTypeDetector;
import com.flamingo.ai.knowledge.service.ingestion.MagicByteValidator;
import com.flamingo.ai.knowledge.service.storage.BlobStorage;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  static final String FALLBACK_CONTENT_TYPE = "application/octet-stream";
  static final int MAX_PAGE_SIZE = 100;
  private static final int DEFAULT_PAGE_SIZE = 50;

  private static final Map<String, String> ORDER_FIELDS =
      Map.of(
          "name", "name",
          "created_at", "createdAt",
          "size_bytes", "sizeBytes",
          "file_type", "fileType");

  private final DocumentRepository documentRepository;
  private final DocumentFolderRepository folderRepository;
  private final DocumentChunkIndexService documentChunkIndexService;
  private final BlobStorage blobStorage;
  private final FileTypeDetector fileTypeDetector;
  private final MagicByteValidator magicByteValidator;
  private final DocumentProcessingQueue processingQueue;
  private final FolderService folderService;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "document.upload", description = "Time to upload a document")
  public Document uploadDocument(String userId, MultipartFile file, UploadOptions options) {
    return upload(userId, file, options != null ? options : UploadOptions.global(), null, 1);
  }

  @Override
  @Transactional
  @Timed(value = "document.upload_version", description = "Time to upload a document version")
  public Document uploadVersion(String userId, UUID documentId, MultipartFile file) {
    Document current = getDocument(userId, documentId);
    UUID rootId = current.versionRootId();
    List<Document> chain = documentRepository.findVersionChain(userId, rootId);
    int nextVersion =
        chain.stream().mapToInt(Document::getVersion).max().orElse(current.getVersion()) + 1;

    UploadOptions placement =
        new UploadOptions(
            current.getScope(), current.getThreadId(), current.getName(), current.getFolderId());
    Document created = upload(userId, file, placement, rootId, nextVersion);

    chain.forEach(version -> version.setLatest(false));
    documentRepository.saveAll(chain);
    log.info("Uploaded version {} of document {} as {}", nextVersion, rootId, created.getId());
    return created;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> listVersions(String userId, UUID documentId) {
    Document document = getDocument(userId, documentId);
    return documentRepository.findVersionChain(userId, document.versionRootId());
  }

  private Document upload(
      String userId,
      MultipartFile file,
      UploadOptions placement,
      UUID parentDocumentId,
      int version) {
    String originalName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "file";
    String contentType = file.getContentType();
    log.info("Uploading document {} ({}) for user {}", originalName, contentType, userId);

    if (file.isEmpty()) {
      throw new FileValidationException("File is empty");
    }
    long maxBytes = knowledgeConfig.getProcessing().getMaxFileSizeBytes();
    if (file.getSize() > maxBytes) {
      throw new FileValidationException(
          "File too large: " + file.getSize() + " bytes (maximum " + maxBytes + ")");
    }

    FileType fileType = fileTypeDetector.detect(contentType, originalName);
    if (fileType == FileType.OTHER) {
      meterRegistry.counter("document.upload.rejected", "reason", "unsupported").increment();
      throw new UnsupportedFileTypeException(contentType, originalName);
    }

    byte[] content = readBytes(file);
    if (!magicByteValidator.validate(content, fileType)) {
      meterRegistry.counter("document.upload.rejected", "reason", "content").increment();
      throw new FileValidationException(
          "File content does not match the expected "
              + magicByteValidator.describe(fileType)
              + " format");
    }

    String contentHash = Hashing.sha256().hashBytes(content).toString();
    if (documentRepository.existsByUserIdAndContentHashAndStatusNot(
        userId, contentHash, DocumentStatus.ARCHIVED)) {
      meterRegistry.counter("document.upload.rejected", "reason", "duplicate").increment();
      throw new DuplicateDocumentException(originalName);
    }

    if (placement.folderId() != null) {
      requireFolder(userId, placement.folderId());
    }

    String storagePath = storagePath(userId, originalName);
    String effectiveContentType = contentType != null ? contentType : FALLBACK_CONTENT_TYPE;
    store(storagePath, content, effectiveContentType, originalName);

    Document saved;
    try {
      Document document =
          Document.builder()
              .userId(userId)
              .name(
                  placement.name() != null && !placement.name().isBlank()
                      ? placement.name().trim()
                      : originalName)
              .originalName(originalName)
              .mimeType(effectiveContentType)
              .sizeBytes(file.getSize())
              .storagePath(storagePath)
              .fileType(fileType)
              .scope(placement.scope() != null ? placement.scope() : DocumentScope.GLOBAL)
              .threadId(placement.threadId())
              .folderId(placement.folderId())
              .contentHash(contentHash)
              .parentDocumentId(parentDocumentId)
              .version(version)
              .build();
      saved = documentRepository.saveAndFlush(document);
    } catch (RuntimeException e) {
      log.error("Failed to create document record for {}: {}", originalName, e.getMessage());
      blobStorage.delete(storagePath);
      throw e;
    }

    meterRegistry
        .counter("document.uploaded", "type", fileType.name().toLowerCase(Locale.ROOT))
        .increment();
    scheduleAfterCommit(saved.getId());

    log.info("Document {} uploaded with ID: {}", originalName, saved.getId());
    return saved;
  }

  /** Writes the blob, retrying once as generic binary when the store refuses the MIME type. */
  private void store(String path, byte[] content, String contentType, String fileName) {
    try {
      blobStorage.put(path, content, contentType);
    } catch (MimeTypeRejectedException e) {
      log.warn(
          "Storage upload rejected MIME type {}, retrying with {} for {}",
          contentType,
          FALLBACK_CONTENT_TYPE,
          fileName);
      blobStorage.put(path, content, FALLBACK_CONTENT_TYPE);
    }
  }

  private void scheduleAfterCommit(UUID documentId) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, queueing document: {}", documentId);
              processingQueue.submit(documentId);
            }
          });
    } else {
      // In tests or non-transactional context, queue directly
      log.debug("No active transaction, queueing document directly: {}", documentId);
      processingQueue.submit(documentId);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Document reprocessDocument(String userId, UUID documentId) {
    Document document = getDocument(userId, documentId);
    if (document.getStatus() == DocumentStatus.ARCHIVED) {
      throw new DocumentProcessingException(
          documentId,
          "Archived document cannot be reprocessed: " + documentId,
          "Archived documents cannot be reprocessed");
    }
    processingQueue.submit(documentId);
    log.info("Queued document {} for reprocessing", documentId);
    return document;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.list", description = "Time to list documents")
  public Page<Document> listDocuments(String userId, DocumentListQuery query) {
    Specification<Document> spec = ownedBy(userId);
    spec = spec.and(query.status() != null ? hasStatus(query.status()) : notArchived());
    if (query.scope() != null) {
      spec = spec.and(hasScope(query.scope()));
    }
    if (query.threadId() != null && !query.threadId().isBlank()) {
      spec = spec.and(inThread(query.threadId()));
    }
    if (query.folderId() != null) {
      spec = spec.and(inFolder(query.folderId()));
    } else if (query.rootOnly()) {
      spec = spec.and(atRoot());
    }

    int limit = query.limit() != null && query.limit() > 0 ? query.limit() : DEFAULT_PAGE_SIZE;
    int offset = query.offset() != null ? Math.max(0, query.offset()) : 0;
    return documentRepository.findAll(
        spec,
        new OffsetPageRequest(
            offset,
            Math.min(limit, MAX_PAGE_SIZE),
            sort(query.orderBy(), query.orderDirection())));
  }

  static Sort sort(String orderBy, String orderDirection) {
    String key = orderBy != null ? orderBy.toLowerCase(Locale.ROOT) : "created_at";
    String field = ORDER_FIELDS.get(key);
    if (field == null) {
      throw new IllegalArgumentException(
          "Invalid orderBy '" + orderBy + "', expected one of " + ORDER_FIELDS.keySet());
    }
    Sort.Direction direction =
        orderDirection == null
            ? Sort.Direction.DESC
            : Sort.Direction.fromOptionalString(orderDirection)
                .orElseThrow(
                    () ->
                        new IllegalArgumentException(
                            "Invalid orderDirection '" + orderDirection + "'"));
    return Sort.by(direction, field);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(String userId, UUID documentId) {
    return documentRepository
        .findByIdAndUserId(documentId, userId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  @Transactional(readOnly = true)
  public DocumentWithChunks getDocumentWithChunks(String userId, UUID documentId) {
    Document document = getDocument(userId, documentId);
    List<DocumentChunk> chunks = documentChunkIndexService.findByDocumentId(documentId);
    return new DocumentWithChunks(document, chunks);
  }

  @Override
  @Transactional
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(String userId, UUID documentId) {
    delete(getDocument(userId, documentId));
  }

  private void delete(Document document) {
    UUID documentId = document.getId();
    documentChunkIndexService.deleteByDocumentId(documentId);
    try {
      blobStorage.delete(document.getStoragePath());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to delete stored file {} of document {}: {}",
          document.getStoragePath(),
          documentId,
          e.getMessage());
      meterRegistry.counter("document.storage.orphaned").increment();
    }
    documentRepository.delete(document);
    if (Boolean.TRUE.equals(document.getLatest())) {
      promoteLatestVersion(document);
    }
    meterRegistry.counter("document.deleted").increment();
    log.info("Deleted document: {}", documentId);
  }

  /** Makes the newest remaining version of a deleted latest version the latest one. */
  private void promoteLatestVersion(Document deleted) {
    documentRepository.findVersionChain(deleted.getUserId(), deleted.versionRootId()).stream()
        .filter(version -> !version.getId().equals(deleted.getId()))
        .findFirst()
        .ifPresent(
            version -> {
              version.setLatest(true);
              documentRepository.save(version);
              log.debug(
                  "Version {} ({}) is now the latest", version.getVersion(), version.getId());
            });
  }

  @Override
  @Transactional
  public Document moveToFolder(String userId, UUID documentId, UUID folderId) {
    folderService.moveDocument(userId, documentId, folderId);
    return getDocument(userId, documentId);
  }

  @Override
  @Transactional
  public Document archiveDocument(String userId, UUID documentId) {
    Document document = getDocument(userId, documentId);
    document.archive();
    Document saved = documentRepository.save(document);
    log.info("Archived document: {}", documentId);
    return saved;
  }

  @Override
  @Transactional
  public int bulkDelete(String userId, Collection<UUID> documentIds) {
    List<Document> documents = documentRepository.findByIdInAndUserId(documentIds, userId);
    documents.forEach(this::delete);
    log.info("Bulk deleted {} of {} documents", documents.size(), documentIds.size());
    return documents.size();
  }

  @Override
  @Transactional
  public int bulkMove(String userId, Collection<UUID> documentIds, UUID folderId) {
    if (folderId != null) {
      requireFolder(userId, folderId);
    }
    List<Document> documents = documentRepository.findByIdInAndUserId(documentIds, userId);
    documents.forEach(document -> document.setFolderId(folderId));
    documentRepository.saveAll(documents);
    log.info("Bulk moved {} of {} documents to {}", documents.size(), documentIds.size(), folderId);
    return documents.size();
  }

  private DocumentFolder requireFolder(String userId, UUID folderId) {
    return folderRepository
        .findByIdAndUserId(folderId, userId)
        .orElseThrow(() -> new FolderNotFoundException(folderId));
  }

  private static byte[] readBytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new FileValidationException("Failed to read file content: " + e.getMessage());
    }
  }

  /** {@code {user}/{timestamp}_{sanitized file name}}. */
  static String storagePath(String userId, String fileName) {
    String safeUser = userId.replaceAll("[^a-zA-Z0-9.-]", "_");
    String safeName = fileName.replaceAll("[^a-zA-Z0-9.-]", "_");
    return safeUser + "/" + System.currentTimeMillis() + "_" + safeName;
  }
}
