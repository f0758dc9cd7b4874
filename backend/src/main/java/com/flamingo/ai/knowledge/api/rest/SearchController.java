package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.request.ConversationContextRequest;
import com.flamingo.ai.knowledge.api.dto.request.DocumentSearchRequest;
import com.flamingo.ai.knowledge.service.search.ConversationContext;
import com.flamingo.ai.knowledge.service.search.DocumentSearchService;
import com.flamingo.ai.knowledge.service.search.SearchOptions;
import com.flamingo.ai.knowledge.service.search.SearchResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for retrieval over the user's documents. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class SearchController {

  private final DocumentSearchService documentSearchService;

  /** Semantic search. */
  @PostMapping("/search")
  public ResponseEntity<List<SearchResult>> search(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @Valid @RequestBody DocumentSearchRequest request) {
    SearchOptions options =
        SearchOptions.builder()
            .limit(request.getLimit())
            .minSimilarity(request.getMinSimilarity())
            .scope(request.getScope())
            .threadId(request.getThreadId())
            .fileTypes(request.getFileTypes())
            .folderId(request.getFolderId())
            .build();
    return ResponseEntity.ok(
        documentSearchService.searchDocuments(userId, request.getQuery(), options));
  }

  /** Document context for a conversation prompt. */
  @PostMapping("/context")
  public ResponseEntity<ConversationContext> context(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @Valid @RequestBody ConversationContextRequest request) {
    int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : 0;
    return ResponseEntity.ok(
        documentSearchService.getConversationContext(
            userId, request.getThreadId(), request.getQuery(), maxTokens));
  }
}
