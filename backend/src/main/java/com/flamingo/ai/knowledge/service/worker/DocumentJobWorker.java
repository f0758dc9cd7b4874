package com.flamingo.ai.knowledge.service.worker;

import com.flamingo.ai.knowledge.service.ingestion.DocumentProcessingService;
import com.flamingo.ai.knowledge.service.ingestion.ProcessingOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs processing jobs handed over by the external job queue.
 *
 * <p>Jobs run synchronously on the caller's thread and are not coalesced with queued runs; the
 * last run to finish decides the document's status. Whatever goes wrong, the worker itself writes
 * the document's error status before reporting the failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentJobWorker {

  private final DocumentProcessingService processingService;
  private final MeterRegistry meterRegistry;

  /**
   * Processes one job.
   *
   * @param job the job, carrying the document id
   * @return the job outcome; never null
   */
  public JobResult process(DocumentJob job) {
    UUID documentId = job != null ? job.documentId() : null;
    if (documentId == null) {
      meterRegistry.counter("worker.jobs", "outcome", "invalid").increment();
      return JobResult.failed("Missing documentId in job input");
    }

    log.info("Worker processing document {}", documentId);
    String error;
    try {
      ProcessingOutcome outcome = processingService.process(documentId);
      if (outcome.success()) {
        meterRegistry.counter("worker.jobs", "outcome", "success").increment();
        return JobResult.succeeded(
            String.format(
                "Processed document %s: %d chunks, %d tokens",
                documentId, outcome.chunkCount(), outcome.tokenCount()));
      }
      error = outcome.error();
    } catch (RuntimeException e) {
      log.error("Worker failed on document {}: {}", documentId, e.getMessage(), e);
      error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    meterRegistry.counter("worker.jobs", "outcome", "failure").increment();
    markFailed(documentId, error);
    return JobResult.failed(error);
  }

  private void markFailed(UUID documentId, String error) {
    try {
      processingService.recordFailure(documentId, error);
    } catch (RuntimeException e) {
      log.error(
          "Failed to record error status for document {}: {}", documentId, e.getMessage(), e);
    }
  }
}
