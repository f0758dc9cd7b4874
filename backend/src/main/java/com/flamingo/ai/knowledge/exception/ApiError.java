package com.flamingo.ai.knowledge.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_PARSE_ERROR = "DOCUMENT_002";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_003";
  public static final String DOCUMENT_DUPLICATE = "DOCUMENT_004";
  public static final String FILE_INVALID = "FILE_001";
  public static final String FILE_UNSUPPORTED = "FILE_002";
  public static final String FOLDER_NOT_FOUND = "FOLDER_001";
  public static final String FOLDER_CYCLE = "FOLDER_002";
  public static final String FOLDER_NAME_CONFLICT = "FOLDER_003";
  public static final String FOLDER_INVALID = "FOLDER_004";
  public static final String STORAGE_ERROR = "STORAGE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
