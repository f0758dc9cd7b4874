package com.flamingo.ai.knowledge.domain.enums;

/** Processing status of an uploaded document. */
public enum DocumentStatus {
  /** Stored and waiting for the processing pipeline. */
  PENDING,

  /** Currently being parsed, chunked and embedded. */
  PROCESSING,

  /** Chunks are indexed and searchable. */
  READY,

  /** Processing failed; see the document's processing error. */
  ERROR,

  /** Hidden from listings, search and folder counts. */
  ARCHIVED
}
