package com.flamingo.ai.knowledge.exception;

/** Exception thrown when chunks cannot be written to or removed from the vector store. */
public class IndexingException extends RuntimeException {

  public IndexingException(String message) {
    super(message);
  }

  public IndexingException(String message, Throwable cause) {
    super(message, cause);
  }
}
