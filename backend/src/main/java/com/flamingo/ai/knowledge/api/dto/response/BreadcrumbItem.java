package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import java.util.UUID;

/** One ancestor in a folder breadcrumb. */
public record BreadcrumbItem(UUID id, String name, UUID parentId) {

  public static BreadcrumbItem fromEntity(DocumentFolder folder) {
    return new BreadcrumbItem(folder.getId(), folder.getName(), folder.getParentId());
  }
}
