package com.flamingo.ai.knowledge.service.document;

import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import java.util.UUID;
import lombok.Builder;

/**
 * Filters, ordering and paging of a document listing.
 *
 * @param folderId only documents directly in this folder
 * @param rootOnly only documents outside any folder; ignored when {@code folderId} is set
 * @param status only documents with this status; archived documents are listed only when asked
 *     for explicitly
 * @param orderBy one of {@code name}, {@code created_at}, {@code size_bytes}, {@code file_type}
 * @param orderDirection {@code asc} or {@code desc}
 */
@Builder
public record DocumentListQuery(
    DocumentScope scope,
    String threadId,
    DocumentStatus status,
    UUID folderId,
    boolean rootOnly,
    Integer limit,
    Integer offset,
    String orderBy,
    String orderDirection) {}
