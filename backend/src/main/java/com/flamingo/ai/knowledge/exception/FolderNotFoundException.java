package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown when a folder does not exist or belongs to another user. */
public class FolderNotFoundException extends RuntimeException {

  private final UUID folderId;

  public FolderNotFoundException(UUID folderId) {
    super("Folder not found: " + folderId);
    this.folderId = folderId;
  }

  public UUID getFolderId() {
    return folderId;
  }
}
