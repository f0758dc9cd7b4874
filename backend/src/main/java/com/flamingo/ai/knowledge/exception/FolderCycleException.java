package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown when a folder move would make a folder its own ancestor. */
public class FolderCycleException extends RuntimeException {

  private final UUID folderId;
  private final UUID targetParentId;

  public FolderCycleException(UUID folderId, UUID targetParentId, String message) {
    super(message);
    this.folderId = folderId;
    this.targetParentId = targetParentId;
  }

  public UUID getFolderId() {
    return folderId;
  }

  public UUID getTargetParentId() {
    return targetParentId;
  }
}
