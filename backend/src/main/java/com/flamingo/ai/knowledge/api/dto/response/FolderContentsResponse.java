package com.flamingo.ai.knowledge.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one level of the folder browser. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FolderContentsResponse {

  private FolderResponse folder;
  private List<BreadcrumbItem> breadcrumb;
  private List<FolderResponse> subfolders;
  private List<DocumentResponse> documents;
  private long totalDocuments;

  public static FolderContentsResponse from(FolderContents contents) {
    return FolderContentsResponse.builder()
        .folder(
            contents.getFolder() != null
                ? FolderResponse.fromEntity(
                    contents.getFolder(), contents.documentCount(contents.getFolder().getId()))
                : null)
        .breadcrumb(contents.getBreadcrumb())
        .subfolders(
            contents.getSubfolders().stream()
                .map(f -> FolderResponse.fromEntity(f, contents.documentCount(f.getId())))
                .toList())
        .documents(contents.getDocuments().stream().map(DocumentResponse::fromEntity).toList())
        .totalDocuments(contents.getTotalDocuments())
        .build();
  }
}
