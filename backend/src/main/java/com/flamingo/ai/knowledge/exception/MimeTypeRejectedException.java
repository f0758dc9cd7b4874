package com.flamingo.ai.knowledge.exception;

/** Exception thrown when the blob store's content-type policy refuses a write. */
public class MimeTypeRejectedException extends StorageException {

  private final String contentType;

  public MimeTypeRejectedException(String contentType) {
    super("Content type not allowed by storage: " + contentType);
    this.contentType = contentType;
  }

  public String getContentType() {
    return contentType;
  }
}
