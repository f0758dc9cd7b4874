package com.flamingo.ai.knowledge.exception;

/** Exception thrown when an upload is rejected before storage: empty, too large, or spoofed. */
public class FileValidationException extends RuntimeException {

  public FileValidationException(String message) {
    super(message);
  }
}
