package com.flamingo.ai.knowledge.service.search;

import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import java.util.List;
import java.util.UUID;
import lombok.Builder;

/**
 * Filters and limits for a document search. Null fields fall back to configured defaults or
 * mean "no filter".
 *
 * @param limit maximum number of results
 * @param minSimilarity minimum cosine similarity of a result to the query
 * @param scope only documents with this scope
 * @param threadId only documents attached to this conversation
 * @param fileTypes only documents of these types
 * @param folderId only documents directly in this folder
 */
@Builder
public record SearchOptions(
    Integer limit,
    Double minSimilarity,
    DocumentScope scope,
    String threadId,
    List<FileType> fileTypes,
    UUID folderId) {

  public static SearchOptions defaults() {
    return SearchOptions.builder().build();
  }
}
