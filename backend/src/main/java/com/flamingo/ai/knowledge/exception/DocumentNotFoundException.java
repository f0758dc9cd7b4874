package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown when a document does not exist or belongs to another user. */
public class DocumentNotFoundException extends RuntimeException {

  private final UUID documentId;

  public DocumentNotFoundException(UUID documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
