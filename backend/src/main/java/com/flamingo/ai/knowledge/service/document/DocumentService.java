package com.flamingo.ai.knowledge.service.document;

import com.flamingo.ai.knowledge.domain.entity.Document;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for document management. */
public interface DocumentService {

  /**
   * Validates and stores an upload, then schedules its processing.
   *
   * <p>Validation happens before anything is written: the file type must be supported, the bytes
   * must match it, and the user must not already have the same content.
   *
   * @param userId the owner
   * @param file the uploaded file
   * @param options scope, display name and folder
   * @return the created document, in {@code PENDING} state
   * @throws com.flamingo.ai.knowledge.exception.UnsupportedFileTypeException if the type is not
   *     supported
   * @throws com.flamingo.ai.knowledge.exception.FileValidationException if the file is empty, too
   *     large, or its bytes do not match its type
   * @throws com.flamingo.ai.knowledge.exception.DuplicateDocumentException if the content was
   *     already uploaded
   */
  Document uploadDocument(String userId, MultipartFile file, UploadOptions options);

  /**
   * Uploads a new version of a document. The new version keeps the document's name, scope, thread
   * and folder, becomes the latest version, and is processed like any upload.
   *
   * @param userId the owner
   * @param documentId any version of the document
   * @param file the new content
   * @return the created version, in {@code PENDING} state
   * @throws com.flamingo.ai.knowledge.exception.DocumentNotFoundException if the user has no such
   *     document
   */
  Document uploadVersion(String userId, UUID documentId, MultipartFile file);

  /**
   * Lists every version of a document, newest first.
   *
   * @param documentId any version of the document
   */
  List<Document> listVersions(String userId, UUID documentId);

  /**
   * Schedules a new processing run that replaces the document's chunks.
   *
   * @return the document as it was when the run was scheduled
   * @throws com.flamingo.ai.knowledge.exception.DocumentProcessingException if the document is
   *     archived
   */
  Document reprocessDocument(String userId, UUID documentId);

  /**
   * Lists the user's documents.
   *
   * @param query filters, ordering and paging
   * @return one page of documents with the total count
   */
  Page<Document> listDocuments(String userId, DocumentListQuery query);

  /**
   * Gets a document owned by the user.
   *
   * @throws com.flamingo.ai.knowledge.exception.DocumentNotFoundException if not found
   */
  Document getDocument(String userId, UUID documentId);

  /** Gets a document together with its chunks. */
  DocumentWithChunks getDocumentWithChunks(String userId, UUID documentId);

  /** Deletes a document with its chunks and stored file. */
  void deleteDocument(String userId, UUID documentId);

  /**
   * Moves a document into a folder.
   *
   * @param folderId the target folder, or null for the root
   */
  Document moveToFolder(String userId, UUID documentId, UUID folderId);

  /** Hides a document from listings, search and folder counts. */
  Document archiveDocument(String userId, UUID documentId);

  /**
   * Deletes several documents. Ids that do not exist or belong to someone else are skipped.
   *
   * @return the number of documents deleted
   */
  int bulkDelete(String userId, Collection<UUID> documentIds);

  /**
   * Moves several documents into a folder. Ids that do not exist or belong to someone else are
   * skipped.
   *
   * @return the number of documents moved
   */
  int bulkMove(String userId, Collection<UUID> documentIds, UUID folderId);
}
