package com.flamingo.ai.knowledge.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.knowledge.exception.IndexingException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides common functionality for indexing, searching, and deleting documents with vector
 * embeddings. Subclasses define document-specific schema and conversion logic.
 *
 * <p>Searches degrade to an empty result when Elasticsearch is unavailable. Writes never degrade:
 * a failed write is reported to the caller so it can compensate.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Returns the vector embedding dimensions.
   *
   * @return the vector dimensions (e.g., 1536 for text-embedding-3-small)
   */
  protected abstract int getVectorDimensions();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /** Converts a document entity to an Elasticsearch document map. */
  protected abstract Map<String, Object> convertToDocument(T entity);

  /** Converts an Elasticsearch document map to a document entity. */
  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /**
   * Builds the vector search request with filters.
   *
   * @param filterCriteria the filter criteria
   * @param queryEmbedding the query embedding
   * @param topK the number of results
   * @return the search request
   */
  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Builds the keyword search request with filters.
   *
   * @param filterCriteria the filter criteria
   * @param query the search query
   * @param topK the number of results
   * @return the search request
   */
  protected abstract SearchRequest buildKeywordSearchRequest(
      Map<String, Object> filterCriteria, String query, int topK);

  /** Builds the delete by query request with criteria. */
  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /**
   * Returns the metric prefix for this index (e.g., "document_chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // only explicitly declared fields are indexed
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but does not allow changing
   * the type of existing fields, so a mismatch fails startup and the index must be recreated.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual != null && entry.getValue()._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), entry.getKey(), entry.getValue()._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkResponse response;
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.True);
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException | RuntimeException e) {
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexingException("Failed to insert chunks: " + e.getMessage(), e);
    }

    if (response.errors()) {
      String reason =
          response.items().stream()
              .filter(item -> item.error() != null)
              .findFirst()
              .map(item -> item.error().reason())
              .orElse("unknown error");
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      log.warn("Some documents failed to index in {}: {}", getIndexName(), reason);
      throw new IndexingException("Failed to insert chunks: " + reason);
    }
    log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      List<T> results = executeSearch(request);
      log.debug("[vectorSearch] index={} returned={}", getIndexName(), results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexingException("Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK) {
    try {
      SearchRequest request = buildKeywordSearchRequest(filterCriteria, query, topK);
      List<T> results = executeSearch(request);
      log.debug(
          "[keywordSearch] index={} query='{}' returned={}", getIndexName(), query, results.size());
      meterRegistry.counter(getMetricPrefix() + ".keyword_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Keyword search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexingException("Keyword search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> keywordSearchFallback(
      Map<String, Object> filterCriteria, String query, int topK, Throwable t) {
    log.warn("{} keyword search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".keyword_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public void deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d ->
                  d.index(getIndexName()).query(deleteQuery).conflicts(Conflicts.Proceed));
      var response = elasticsearchClient.deleteByQuery(request);
      refresh();
      log.info(
          "Deleted {} documents from {} with criteria: {}",
          response.deleted(),
          getIndexName(),
          criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException | RuntimeException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new IndexingException("Failed to delete chunks: " + e.getMessage(), e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  /** Runs a search and converts the hits, keeping their scores. */
  @SuppressWarnings({"unchecked", "rawtypes"})
  protected List<T> executeSearch(SearchRequest request) throws IOException {
    SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }
}
