package com.flamingo.ai.knowledge.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(FolderNotFoundException.class)
  public ResponseEntity<ApiError> handleFolderNotFound(
      FolderNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("folder_not_found");
    String errorId = generateErrorId();
    log.warn("Folder not found [{}]: {}", errorId, ex.getFolderId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.FOLDER_NOT_FOUND, "Folder not found", request);
  }

  @ExceptionHandler(UnsupportedFileTypeException.class)
  public ResponseEntity<ApiError> handleUnsupportedFileType(
      UnsupportedFileTypeException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_file_type");
    String errorId = generateErrorId();
    log.warn("Unsupported upload [{}]: {} ({})", errorId, ex.getFileName(), ex.getMimeType());

    return respond(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        errorId,
        ApiError.FILE_UNSUPPORTED,
        "Unsupported file type: " + ex.getMimeType(),
        request);
  }

  @ExceptionHandler(FileValidationException.class)
  public ResponseEntity<ApiError> handleFileValidation(
      FileValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("file_validation");
    String errorId = generateErrorId();
    log.warn("File rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.FILE_INVALID, ex.getMessage(), request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("file_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.FILE_INVALID,
        "File size exceeds 50MB limit",
        request);
  }

  @ExceptionHandler(DuplicateDocumentException.class)
  public ResponseEntity<ApiError> handleDuplicate(
      DuplicateDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("duplicate_document");
    String errorId = generateErrorId();
    log.warn("Duplicate upload [{}]: {}", errorId, ex.getFileName());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.DOCUMENT_DUPLICATE,
        "This file has already been uploaded",
        request);
  }

  @ExceptionHandler(FolderCycleException.class)
  public ResponseEntity<ApiError> handleFolderCycle(
      FolderCycleException ex, HttpServletRequest request) {

    incrementErrorCounter("folder_cycle");
    String errorId = generateErrorId();
    log.warn(
        "Folder move rejected [{}]: folder={}, target={}",
        errorId,
        ex.getFolderId(),
        ex.getTargetParentId());

    return respond(HttpStatus.CONFLICT, errorId, ApiError.FOLDER_CYCLE, ex.getMessage(), request);
  }

  @ExceptionHandler(FolderNameConflictException.class)
  public ResponseEntity<ApiError> handleFolderNameConflict(
      FolderNameConflictException ex, HttpServletRequest request) {

    incrementErrorCounter("folder_name_conflict");
    String errorId = generateErrorId();
    log.warn("Folder name conflict [{}]: {}", errorId, ex.getName());

    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.FOLDER_NAME_CONFLICT, ex.getMessage(), request);
  }

  @ExceptionHandler(FolderValidationException.class)
  public ResponseEntity<ApiError> handleFolderValidation(
      FolderValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("folder_validation");
    String errorId = generateErrorId();
    log.warn("Folder rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.FOLDER_INVALID, ex.getMessage(), request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest request) {

    incrementErrorCounter("storage_error");
    String errorId = generateErrorId();
    log.error("Storage error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.STORAGE_ERROR,
        "Failed to store file",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    MissingRequestHeaderException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("bad_request");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
