package com.flamingo.ai.knowledge.exception;

/** Exception thrown when a sibling folder already uses the requested name. */
public class FolderNameConflictException extends RuntimeException {

  private final String name;

  public FolderNameConflictException(String name) {
    super("A folder named '" + name + "' already exists here");
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
