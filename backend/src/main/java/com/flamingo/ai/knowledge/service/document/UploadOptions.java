package com.flamingo.ai.knowledge.service.document;

import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import java.util.UUID;

/**
 * Placement of an uploaded document.
 *
 * @param scope global, or attached to one conversation; null means global
 * @param threadId the conversation, for conversation scope
 * @param name display name; null means the original file name
 * @param folderId target folder; null means the root
 */
public record UploadOptions(DocumentScope scope, String threadId, String name, UUID folderId) {

  public static UploadOptions global() {
    return new UploadOptions(DocumentScope.GLOBAL, null, null, null);
  }
}
