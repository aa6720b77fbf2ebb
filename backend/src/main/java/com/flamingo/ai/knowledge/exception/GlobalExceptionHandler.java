package com.flamingo.ai.knowledge.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(EmptyDocumentException.class)
  public ResponseEntity<ApiError> handleEmptyDocument(
      EmptyDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("empty_document");
    String errorId = generateErrorId();
    log.warn("Empty document rejected [{}]: {}", errorId, ex.getDocumentId());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.DOCUMENT_EMPTY, ex.getUserMessage(), request);
  }

  @ExceptionHandler(DocumentTooLargeException.class)
  public ResponseEntity<ApiError> handleDocumentTooLarge(
      DocumentTooLargeException ex, HttpServletRequest request) {

    incrementErrorCounter("document_too_large");
    String errorId = generateErrorId();
    log.warn("Document too large [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.DOCUMENT_TOO_LARGE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(IngestionJobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      IngestionJobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_found");
    String errorId = generateErrorId();
    log.warn("Ingestion job not found [{}]: {}", errorId, ex.getJobId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Ingestion job not found", request);
  }

  @ExceptionHandler(JobNotCancellableException.class)
  public ResponseEntity<ApiError> handleJobNotCancellable(
      JobNotCancellableException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_cancellable");
    String errorId = generateErrorId();
    log.warn("Job not cancellable [{}]: {} is {}", errorId, ex.getJobId(), ex.getStatus());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.JOB_NOT_CANCELLABLE,
        "Job has already finished with status " + ex.getStatus(),
        request);
  }

  @ExceptionHandler(EmbeddingDimensionException.class)
  public ResponseEntity<ApiError> handleEmbeddingDimension(
      EmbeddingDimensionException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_dimension");
    String errorId = generateErrorId();
    log.error("Embedding dimension mismatch [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.EMBEDDING_DIMENSION,
        "Embedding has the wrong dimension",
        request);
  }

  @ExceptionHandler(ChunkStoreException.class)
  public ResponseEntity<ApiError> handleChunkStore(
      ChunkStoreException ex, HttpServletRequest request) {

    incrementErrorCounter("store_unavailable");
    String errorId = generateErrorId();
    log.error("Chunk store error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.STORE_UNAVAILABLE)
                .message(ex.getUserMessage())
                .retryable(ex.isRetryable())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(OwnerIsolationViolationException.class)
  public ResponseEntity<ApiError> handleOwnerIsolation(
      OwnerIsolationViolationException ex, HttpServletRequest request) {

    incrementErrorCounter("owner_isolation_violation");
    String errorId = generateErrorId();
    log.error(
        "Owner isolation violation [{}]: owner={}, chunk={}: {}",
        errorId,
        ex.getOwnerId(),
        ex.getChunkId(),
        ex.getMessage(),
        ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.OWNER_ISOLATION,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
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
    ConstraintViolationException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HandlerMethodValidationException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof HttpMessageNotReadableException
            ? "Malformed request body"
            : ex.getMessage();
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
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
