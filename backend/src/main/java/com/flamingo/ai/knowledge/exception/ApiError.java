package com.flamingo.ai.knowledge.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_EMPTY = "DOCUMENT_001";
  public static final String DOCUMENT_TOO_LARGE = "DOCUMENT_002";
  public static final String JOB_NOT_FOUND = "JOB_001";
  public static final String JOB_NOT_CANCELLABLE = "JOB_002";
  public static final String EMBEDDING_DIMENSION = "EMBEDDING_001";
  public static final String STORE_UNAVAILABLE = "STORE_001";
  public static final String OWNER_ISOLATION = "STORE_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, when safe to expose. */
  private final String details;

  /** Whether the same request may succeed later. */
  private final boolean retryable;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
