package com.flamingo.ai.knowledge.exception;

/** Exception thrown when the embedding provider fails a whole batch. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
