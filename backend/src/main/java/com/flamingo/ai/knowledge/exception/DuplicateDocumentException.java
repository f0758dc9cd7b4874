package com.flamingo.ai.knowledge.exception;

/** Exception thrown when the same content is uploaded twice by one user. */
public class DuplicateDocumentException extends RuntimeException {

  private final String fileName;

  public DuplicateDocumentException(String fileName) {
    super("A document with the same content already exists: " + fileName);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
