package com.flamingo.ai.knowledge.exception;

/** Exception thrown when the blob store cannot read, write or delete an object. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
