package com.flamingo.ai.knowledge.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.exception.IndexingException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for {@link DocumentChunk} documents.
 *
 * <p>Every search is restricted to an explicit set of document ids resolved by the caller, so
 * ownership and status filtering stay in the relational store.
 */
@Service
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk> {

  static final String DOCUMENT_IDS = "documentIds";
  static final String DOCUMENT_ID = "documentId";
  private static final int MAX_NUM_CANDIDATES = 10_000;
  private static final int MAX_CHUNKS_PER_DOCUMENT = 10_000;

  @Value("${knowledge.elasticsearch.index-name:knowledge-chunks}")
  private String indexName;

  @Value("${knowledge.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // documentId MUST be keyword type for exact matching
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("chunkType", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourcePage", Property.of(p -> p.integer(i -> i)));
    properties.put("sourceLineStart", Property.of(p -> p.integer(i -> i)));
    properties.put("sourceLineEnd", Property.of(p -> p.integer(i -> i)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    // parser metadata is stored but not searchable
    properties.put("metadata", Property.of(p -> p.object(o -> o.enabled(false))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId().toString());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("content", chunk.getContent());
    document.put("chunkType", chunk.getChunkType().name());
    document.put("tokenCount", chunk.getTokenCount());
    if (chunk.getSourcePage() != null) {
      document.put("sourcePage", chunk.getSourcePage());
    }
    if (chunk.getSourceLineStart() != null) {
      document.put("sourceLineStart", chunk.getSourceLineStart());
    }
    if (chunk.getSourceLineEnd() != null) {
      document.put("sourceLineEnd", chunk.getSourceLineEnd());
    }
    // chunks without a vector are left out of k-NN but still match keyword search
    if (chunk.getEmbedding() != null && !chunk.getEmbedding().isEmpty()) {
      document.put("embedding", chunk.getEmbedding());
    }
    if (chunk.getMetadata() != null && !chunk.getMetadata().isEmpty()) {
      document.put("metadata", chunk.getMetadata());
    }
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected DocumentChunk convertFromDocument(Map<String, Object> source) {
    DocumentChunk.DocumentChunkBuilder builder =
        DocumentChunk.builder()
            .id((String) source.get("id"))
            .documentId(UUID.fromString((String) source.get("documentId")))
            .chunkIndex(intValue(source.get("chunkIndex")))
            .content((String) source.get("content"))
            .chunkType(ChunkType.valueOf((String) source.get("chunkType")))
            .sourcePage(integerValue(source.get("sourcePage")))
            .sourceLineStart(integerValue(source.get("sourceLineStart")))
            .sourceLineEnd(integerValue(source.get("sourceLineEnd")))
            .tokenCount(intValue(source.get("tokenCount")));
    if (source.get("metadata") instanceof Map<?, ?> metadata) {
      builder.metadata((Map<String, Object>) metadata);
    }
    return builder.build();
  }

  private static Integer integerValue(Object value) {
    return value instanceof Number number ? number.intValue() : null;
  }

  private static int intValue(Object value) {
    return value instanceof Number number ? number.intValue() : 0;
  }

  @Override
  protected String getDocumentId(DocumentChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    List<FieldValue> documentIds = requireDocumentIds(filterCriteria);
    log.debug(
        "vectorSearch over {} documents, topK={}, embedding size={}",
        documentIds.size(),
        topK,
        queryEmbedding.size());

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.min(topK * 2, MAX_NUM_CANDIDATES))
                            .filter(
                                f ->
                                    f.terms(
                                        t ->
                                            t.field("documentId")
                                                .terms(tv -> tv.value(documentIds)))))
                .size(topK));
  }

  @Override
  protected SearchRequest buildKeywordSearchRequest(
      Map<String, Object> filterCriteria, String query, int topK) {
    List<FieldValue> documentIds = requireDocumentIds(filterCriteria);
    log.debug(
        "keywordSearch over {} documents, query='{}', topK={}", documentIds.size(), query, topK);

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(
                    q ->
                        q.bool(
                            b ->
                                b.filter(
                                        f ->
                                            f.terms(
                                                t ->
                                                    t.field("documentId")
                                                        .terms(tv -> tv.value(documentIds))))
                                    .must(m -> m.match(mt -> mt.field("content").query(query)))))
                .size(topK));
  }

  @SuppressWarnings("unchecked")
  private static List<FieldValue> requireDocumentIds(Map<String, Object> filterCriteria) {
    Collection<UUID> documentIds = (Collection<UUID>) filterCriteria.get(DOCUMENT_IDS);
    if (documentIds == null || documentIds.isEmpty()) {
      throw new IllegalArgumentException("documentIds filter is required for chunk search");
    }
    return documentIds.stream().map(id -> FieldValue.of(id.toString())).toList();
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    UUID documentId = (UUID) criteria.get(DOCUMENT_ID);
    if (documentId == null) {
      throw new IllegalArgumentException("deleteBy requires documentId in criteria");
    }
    return Query.of(q -> q.term(t -> t.field("documentId").value(documentId.toString())));
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }

  /** Indexes document chunks (convenience method). */
  public void indexChunks(List<DocumentChunk> chunks) {
    indexDocuments(chunks);
  }

  /** Convenience method: k-NN search restricted to the given documents. */
  public List<DocumentChunk> vectorSearch(
      Collection<UUID> documentIds, List<Float> queryEmbedding, int topK) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(DOCUMENT_IDS, documentIds);
    return vectorSearch(criteria, queryEmbedding, topK);
  }

  /** Convenience method: BM25 keyword search restricted to the given documents. */
  public List<DocumentChunk> keywordSearch(Collection<UUID> documentIds, String query, int topK) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(DOCUMENT_IDS, documentIds);
    return keywordSearch(criteria, query, topK);
  }

  /**
   * Deletes all chunks for a document (convenience method).
   *
   * @param documentId the document ID
   */
  public void deleteByDocumentId(UUID documentId) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(DOCUMENT_ID, documentId);
    deleteBy(criteria);
  }

  /**
   * Loads every chunk of a document in chunk order.
   *
   * @param documentId the document ID
   * @return the chunks ordered by chunk index
   */
  public List<DocumentChunk> findByDocumentId(UUID documentId) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(q -> q.term(t -> t.field("documentId").value(documentId.toString())))
                    .sort(so -> so.field(f -> f.field("chunkIndex").order(SortOrder.Asc)))
                    .size(MAX_CHUNKS_PER_DOCUMENT));
    try {
      return executeSearch(request);
    } catch (IOException e) {
      log.error("Failed to load chunks of document {}: {}", documentId, e.getMessage(), e);
      throw new IndexingException("Failed to load chunks: " + e.getMessage(), e);
    }
  }
}
