package com.flamingo.ai.knowledge.service.ingestion;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs document processing in the background on the {@code documentProcessingExecutor} pool.
 *
 * <p>A submission for a document that already has a run in flight on this instance joins that
 * run instead of starting another one.
 */
@Service
@Slf4j
public class DocumentProcessingQueue {

  private final DocumentProcessingService processingService;
  private final Executor executor;
  private final Map<UUID, CompletableFuture<ProcessingOutcome>> inFlight =
      new ConcurrentHashMap<>();

  public DocumentProcessingQueue(
      DocumentProcessingService processingService,
      @Qualifier("documentProcessingExecutor") Executor executor) {
    this.processingService = processingService;
    this.executor = executor;
  }

  /**
   * Schedules a processing run.
   *
   * @param documentId the document to process
   * @return a future completed with the run's outcome, never completed exceptionally
   */
  public CompletableFuture<ProcessingOutcome> submit(UUID documentId) {
    CompletableFuture<ProcessingOutcome> future;
    try {
      future =
          inFlight.computeIfAbsent(
              documentId,
              id -> CompletableFuture.supplyAsync(() -> processingService.process(id), executor));
    } catch (RejectedExecutionException e) {
      log.error("Processing queue rejected document {}: {}", documentId, e.getMessage());
      String error = "Processing queue is full, retry later";
      processingService.recordFailure(documentId, error);
      return CompletableFuture.completedFuture(ProcessingOutcome.failed(documentId, error));
    }
    future.whenComplete((outcome, ex) -> inFlight.remove(documentId, future));
    log.debug("Queued document {} for processing", documentId);
    return future;
  }

  /** Whether a run for the document is queued or running on this instance. */
  public boolean isInFlight(UUID documentId) {
    return inFlight.containsKey(documentId);
  }
}
