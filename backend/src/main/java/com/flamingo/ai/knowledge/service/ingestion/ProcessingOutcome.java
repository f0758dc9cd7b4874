package com.flamingo.ai.knowledge.service.ingestion;

import java.util.UUID;

/**
 * Result of one processing run.
 *
 * @param documentId the processed document
 * @param success whether the document reached the ready state
 * @param chunkCount chunks persisted by the run, zero on failure
 * @param tokenCount sum of the persisted chunks' token estimates, zero on failure
 * @param error the failure message, null on success
 */
public record ProcessingOutcome(
    UUID documentId, boolean success, int chunkCount, int tokenCount, String error) {

  public static ProcessingOutcome succeeded(UUID documentId, int chunkCount, int tokenCount) {
    return new ProcessingOutcome(documentId, true, chunkCount, tokenCount, null);
  }

  public static ProcessingOutcome failed(UUID documentId, String error) {
    return new ProcessingOutcome(documentId, false, 0, 0, error);
  }
}
