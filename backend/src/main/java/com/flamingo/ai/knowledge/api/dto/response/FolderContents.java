package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One level of the folder browser: the folder itself (null at the root), its breadcrumb, its
 * direct subfolders and a page of the documents directly inside it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FolderContents {

  private DocumentFolder folder;
  private List<BreadcrumbItem> breadcrumb;
  private List<DocumentFolder> subfolders;
  private List<Document> documents;
  private long totalDocuments;

  /** Non-archived document counts keyed by folder id, for the folder and its subfolders. */
  private Map<UUID, Long> documentCounts;

  public long documentCount(UUID folderId) {
    return documentCounts != null ? documentCounts.getOrDefault(folderId, 0L) : 0L;
  }
}
