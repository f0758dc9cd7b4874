package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import java.util.Collection;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

/** Query building blocks for {@link Document} listings and search candidate resolution. */
public final class DocumentSpecifications {

  private DocumentSpecifications() {}

  public static Specification<Document> ownedBy(String userId) {
    return (root, query, cb) -> cb.equal(root.get("userId"), userId);
  }

  public static Specification<Document> hasStatus(DocumentStatus status) {
    return (root, query, cb) -> cb.equal(root.get("status"), status);
  }

  public static Specification<Document> notArchived() {
    return (root, query, cb) -> cb.notEqual(root.get("status"), DocumentStatus.ARCHIVED);
  }

  public static Specification<Document> hasScope(DocumentScope scope) {
    return (root, query, cb) -> cb.equal(root.get("scope"), scope);
  }

  public static Specification<Document> inThread(String threadId) {
    return (root, query, cb) -> cb.equal(root.get("threadId"), threadId);
  }

  public static Specification<Document> fileTypeIn(Collection<FileType> fileTypes) {
    return (root, query, cb) -> root.get("fileType").in(fileTypes);
  }

  public static Specification<Document> inFolder(UUID folderId) {
    return (root, query, cb) -> cb.equal(root.get("folderId"), folderId);
  }

  public static Specification<Document> atRoot() {
    return (root, query, cb) -> cb.isNull(root.get("folderId"));
  }
}
