package com.flamingo.ai.knowledge.service.search;

import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.fileTypeIn;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.hasScope;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.hasStatus;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.inFolder;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.inThread;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.ownedBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunk;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.knowledge.service.ingestion.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval over the user's ready documents.
 *
 * <p>Eligible documents are resolved in the relational store first; chunk searches are then
 * restricted to those document ids. Only k-NN hits at or above the similarity threshold are
 * returned, ordered by Reciprocal Rank Fusion of their vector rank and their BM25 rank. Both entry
 * points return an empty result instead of throwing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentSearchService {

  private static final String CONTEXT_SEPARATOR = "\n\n---\n\n";

  private final DocumentRepository documentRepository;
  private final DocumentChunkIndexService documentChunkIndexService;
  private final EmbeddingService embeddingService;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Semantic search over the user's ready documents.
   *
   * @param userId the owner of the documents
   * @param query the search text
   * @param options filters and limits
   * @return matching chunks, best first; empty when nothing matches or search fails
   */
  @Timed(value = "search.documents", description = "Time for document search")
  public List<SearchResult> searchDocuments(String userId, String query, SearchOptions options) {
    SearchOptions opts = options != null ? options : SearchOptions.defaults();
    KnowledgeConfig.Search config = knowledgeConfig.getSearch();
    int limit = opts.limit() != null && opts.limit() > 0 ? opts.limit() : config.getDefaultLimit();
    double minSimilarity =
        opts.minSimilarity() != null ? opts.minSimilarity() : config.getMinSimilarity();

    try {
      List<Float> embedding = embeddingService.embedQuery(query);
      if (embedding.isEmpty()) {
        log.warn("Failed to generate embedding for search query");
        meterRegistry.counter("search.documents.empty", "reason", "embedding").increment();
        return List.of();
      }

      Map<UUID, Document> documents = eligibleDocuments(userId, opts);
      if (documents.isEmpty()) {
        log.debug("No ready documents match the search filters for user {}", userId);
        return List.of();
      }

      int candidates = limit * config.getCandidatesMultiplier();
      List<DocumentChunk> vectorHits =
          documentChunkIndexService.vectorSearch(documents.keySet(), embedding, candidates);
      List<DocumentChunk> keywordHits =
          documentChunkIndexService.keywordSearch(documents.keySet(), query, candidates);

      List<ScoredChunk> qualified = qualify(vectorHits, minSimilarity);
      List<ScoredChunk> ranked = fuse(qualified, keywordHits, config.getRrfK());

      List<SearchResult> results =
          ranked.stream().limit(limit).map(hit -> toResult(hit, documents)).toList();
      log.debug(
          "Search returned {} results (vector={}, qualified={}, keyword={})",
          results.size(),
          vectorHits.size(),
          qualified.size(),
          keywordHits.size());
      meterRegistry.counter("search.documents.success").increment();
      return results;
    } catch (RuntimeException e) {
      log.error("Document search failed for user {}: {}", userId, e.getMessage(), e);
      meterRegistry.counter("search.documents.failure").increment();
      return List.of();
    }
  }

  /**
   * Assembles document text for a conversation within a token budget.
   *
   * <p>Candidates are the user's ready global documents plus those attached to {@code threadId}.
   * Chunks are taken best first until the next one would exceed {@code maxTokens}.
   *
   * @param maxTokens token budget; non-positive values use the configured default
   * @return the assembled context; empty when nothing qualifies or retrieval fails
   */
  @Timed(value = "search.context", description = "Time to assemble conversation context")
  public ConversationContext getConversationContext(
      String userId, String threadId, String query, int maxTokens) {
    KnowledgeConfig.Search config = knowledgeConfig.getSearch();
    int budget = maxTokens > 0 ? maxTokens : config.getContextMaxTokens();

    try {
      List<Float> embedding = embeddingService.embedQuery(query);
      if (embedding.isEmpty()) {
        log.warn("Failed to generate embedding for conversation context");
        return ConversationContext.empty();
      }

      Map<UUID, Document> documents =
          documentRepository
              .findConversationCandidates(
                  userId, threadId, DocumentStatus.READY, DocumentScope.GLOBAL)
              .stream()
              .collect(Collectors.toMap(Document::getId, Function.identity(), (a, b) -> a));
      if (documents.isEmpty()) {
        return ConversationContext.empty();
      }

      int candidates = config.getDefaultLimit() * config.getCandidatesMultiplier();
      List<ScoredChunk> ranked =
          qualify(
              documentChunkIndexService.vectorSearch(documents.keySet(), embedding, candidates),
              config.getContextMinSimilarity());

      List<String> parts = new ArrayList<>();
      List<ConversationContext.Source> sources = new ArrayList<>();
      int usedTokens = 0;
      for (ScoredChunk hit : ranked) {
        DocumentChunk chunk = hit.chunk();
        if (usedTokens + chunk.getTokenCount() > budget) {
          break;
        }
        usedTokens += chunk.getTokenCount();
        String documentName = documentName(documents, chunk.getDocumentId());
        parts.add("[From " + documentName + "]\n" + chunk.getContent());
        sources.add(
            new ConversationContext.Source(
                chunk.getId(), chunk.getDocumentId(), documentName, hit.similarity(), usedTokens));
      }

      log.debug(
          "Conversation context for thread {}: {} chunks, {} of {} tokens",
          threadId,
          sources.size(),
          usedTokens,
          budget);
      return new ConversationContext(String.join(CONTEXT_SEPARATOR, parts), sources);
    } catch (RuntimeException e) {
      log.error("Failed to build conversation context for user {}: {}", userId, e.getMessage(), e);
      meterRegistry.counter("search.context.failure").increment();
      return ConversationContext.empty();
    }
  }

  private Map<UUID, Document> eligibleDocuments(String userId, SearchOptions options) {
    Specification<Document> spec = ownedBy(userId).and(hasStatus(DocumentStatus.READY));
    if (options.scope() != null) {
      spec = spec.and(hasScope(options.scope()));
    }
    if (options.threadId() != null && !options.threadId().isBlank()) {
      spec = spec.and(inThread(options.threadId()));
    }
    if (options.fileTypes() != null && !options.fileTypes().isEmpty()) {
      spec = spec.and(fileTypeIn(options.fileTypes()));
    }
    if (options.folderId() != null) {
      spec = spec.and(inFolder(options.folderId()));
    }
    return documentRepository.findAll(spec).stream()
        .collect(Collectors.toMap(Document::getId, Function.identity(), (a, b) -> a));
  }

  /**
   * Keeps vector hits at or above the threshold, preserving their order.
   *
   * <p>Elasticsearch reports cosine hits as {@code (1 + cosine) / 2}; this maps them back.
   */
  static List<ScoredChunk> qualify(List<DocumentChunk> vectorHits, double minSimilarity) {
    List<ScoredChunk> qualified = new ArrayList<>();
    for (DocumentChunk chunk : vectorHits) {
      double score = chunk.getRelevanceScore() != null ? chunk.getRelevanceScore() : 0.0;
      double similarity = 2 * score - 1;
      if (similarity >= minSimilarity) {
        qualified.add(new ScoredChunk(chunk, similarity));
      }
    }
    return qualified;
  }

  /**
   * Orders qualified hits by RRF score: {@code 1/(k + vectorRank) + 1/(k + keywordRank)}, the
   * keyword term present only for chunks the BM25 search also returned.
   */
  static List<ScoredChunk> fuse(
      List<ScoredChunk> qualified, List<DocumentChunk> keywordHits, int rrfK) {
    Map<String, Integer> keywordRanks = new HashMap<>();
    for (int i = 0; i < keywordHits.size(); i++) {
      keywordRanks.putIfAbsent(keywordHits.get(i).getId(), i + 1);
    }

    Map<String, Double> fused = new HashMap<>();
    for (int i = 0; i < qualified.size(); i++) {
      String id = qualified.get(i).chunk().getId();
      double score = 1.0 / (rrfK + i + 1);
      Integer keywordRank = keywordRanks.get(id);
      if (keywordRank != null) {
        score += 1.0 / (rrfK + keywordRank);
      }
      fused.put(id, score);
    }

    List<ScoredChunk> ordered = new ArrayList<>(qualified);
    ordered.sort(
        Comparator.comparingDouble((ScoredChunk hit) -> fused.get(hit.chunk().getId()))
            .reversed());
    return ordered;
  }

  private static SearchResult toResult(ScoredChunk hit, Map<UUID, Document> documents) {
    DocumentChunk chunk = hit.chunk();
    Document document = documents.get(chunk.getDocumentId());
    return new SearchResult(
        chunk.getId(),
        chunk.getDocumentId(),
        document != null ? document.getName() : null,
        document != null ? document.getFileType() : null,
        chunk.getContent(),
        chunk.getChunkType(),
        chunk.getSourcePage(),
        hit.similarity(),
        chunk.getMetadata());
  }

  private static String documentName(Map<UUID, Document> documents, UUID documentId) {
    Document document = documents.get(documentId);
    return document != null ? document.getName() : String.valueOf(documentId);
  }

  /** A vector hit with its cosine similarity to the query. */
  record ScoredChunk(DocumentChunk chunk, double similarity) {}
}
