package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunk;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.service.ingestion.embedding.EmbeddingService;
import com.flamingo.ai.knowledge.service.ingestion.parsing.DocumentParserRegistry;
import com.flamingo.ai.knowledge.service.ingestion.parsing.ParsedChunk;
import com.flamingo.ai.knowledge.service.ingestion.parsing.ParsedDocument;
import com.flamingo.ai.knowledge.service.storage.BlobStorage;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;

/**
 * Orchestrates document processing: download, parse, chunk, embed, and index.
 *
 * <p>A run moves the document to {@code PROCESSING} before any work starts and ends in either
 * {@code READY} or {@code ERROR}. Failures are recorded on the document and returned in the
 * {@link ProcessingOutcome}; {@link #process(UUID)} never throws. A run replaces the document's
 * chunks wholesale and leaves none behind when it fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

  private final DocumentRepository documentRepository;
  private final BlobStorage blobStorage;
  private final DocumentParserRegistry parserRegistry;
  private final TokenEstimator tokenEstimator;
  private final EmbeddingService embeddingService;
  private final DocumentChunkIndexService documentChunkIndexService;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  /**
   * Processes a document synchronously.
   *
   * @param documentId the document to process
   * @return the outcome of the run
   */
  @Timed(value = "document.process", description = "Time to process document")
  public ProcessingOutcome process(UUID documentId) {
    Document document;
    try {
      document = updateDocumentWithRetry(documentId, Document::startProcessing);
    } catch (DocumentNotFoundException | IllegalStateException e) {
      log.warn("Skipping processing of document {}: {}", documentId, e.getMessage());
      meterRegistry.counter("document.processing.failure").increment();
      return ProcessingOutcome.failed(documentId, e.getMessage());
    }

    try {
      byte[] content = blobStorage.get(document.getStoragePath());
      ParsedDocument parsed =
          parserRegistry.parse(content, document.getFileType(), document.getOriginalName());

      List<DocumentChunk> chunks = buildChunks(documentId, parsed.chunks());
      attachEmbeddings(documentId, chunks);

      // reprocessing replaces, never appends
      documentChunkIndexService.deleteByDocumentId(documentId);
      for (List<DocumentChunk> batch :
          Lists.partition(chunks, knowledgeConfig.getProcessing().getInsertBatchSize())) {
        documentChunkIndexService.indexChunks(batch);
      }

      int chunkCount = chunks.size();
      int tokenCount = chunks.stream().mapToInt(DocumentChunk::getTokenCount).sum();
      updateDocumentWithRetry(
          documentId, d -> d.markReady(chunkCount, tokenCount, parsed.metadata()));

      meterRegistry.counter("document.processing.success").increment();
      log.info(
          "Processed document {} ({}): {} chunks, {} tokens",
          documentId,
          document.getFileType(),
          chunkCount,
          tokenCount);
      return ProcessingOutcome.succeeded(documentId, chunkCount, tokenCount);

    } catch (Exception e) {
      String error = errorMessage(e);
      log.error("Failed to process document {}: {}", documentId, error, e);
      meterRegistry.counter("document.processing.failure").increment();
      // an earlier run's chunks go too, so ERROR always means zero chunks
      removeChunks(documentId);
      try {
        recordFailure(documentId, error);
      } catch (RuntimeException statusEx) {
        log.error(
            "Failed to record error status for document {}: {}",
            documentId,
            statusEx.getMessage(),
            statusEx);
      }
      return ProcessingOutcome.failed(documentId, error);
    }
  }

  /**
   * Moves a document to {@code ERROR} with the given message.
   *
   * @throws DocumentNotFoundException if the document no longer exists
   */
  public void recordFailure(UUID documentId, String error) {
    updateDocumentWithRetry(documentId, d -> d.markFailed(error));
  }

  private List<DocumentChunk> buildChunks(UUID documentId, List<ParsedChunk> parsedChunks) {
    List<DocumentChunk> chunks = new ArrayList<>(parsedChunks.size());
    for (int i = 0; i < parsedChunks.size(); i++) {
      ParsedChunk parsed = parsedChunks.get(i);
      chunks.add(
          DocumentChunk.builder()
              .id(DocumentChunk.chunkId(documentId, i))
              .documentId(documentId)
              .chunkIndex(i)
              .content(parsed.content())
              .chunkType(parsed.chunkType())
              .sourcePage(parsed.sourcePage())
              .sourceLineStart(parsed.sourceLineStart())
              .sourceLineEnd(parsed.sourceLineEnd())
              .tokenCount(tokenEstimator.estimate(parsed.content(), parsed.chunkType()))
              .metadata(parsed.metadata())
              .build());
    }
    return chunks;
  }

  private void attachEmbeddings(UUID documentId, List<DocumentChunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    List<List<Float>> embeddings =
        embeddingService.embedBatch(chunks.stream().map(DocumentChunk::getContent).toList());

    int missing = 0;
    for (int i = 0; i < chunks.size(); i++) {
      List<Float> embedding = i < embeddings.size() ? embeddings.get(i) : null;
      if (embedding == null || embedding.isEmpty()) {
        missing++;
      } else {
        chunks.get(i).setEmbedding(embedding);
      }
    }
    if (missing > 0) {
      log.warn(
          "{} of {} chunks of document {} have no embedding", missing, chunks.size(), documentId);
      meterRegistry.counter("document.processing.embedding_missing").increment(missing);
    }
  }

  private void removeChunks(UUID documentId) {
    try {
      documentChunkIndexService.deleteByDocumentId(documentId);
    } catch (RuntimeException e) {
      log.error(
          "Failed to remove chunks of failed document {}: {}", documentId, e.getMessage(), e);
    }
  }

  /** Loads, mutates and flushes a document, retrying on SQLite lock contention. */
  private Document updateDocumentWithRetry(UUID documentId, Consumer<Document> mutation) {
    for (int attempt = 1; ; attempt++) {
      try {
        Document document =
            documentRepository
                .findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        mutation.accept(document);
        documentRepository.saveAndFlush(document);
        return document;
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", documentId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }

  private static String errorMessage(Exception e) {
    String message = e.getMessage();
    return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
  }
}
