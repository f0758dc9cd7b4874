package com.flamingo.ai.knowledge.exception;

/** Exception thrown for an invalid folder name or color. */
public class FolderValidationException extends RuntimeException {

  public FolderValidationException(String message) {
    super(message);
  }
}
