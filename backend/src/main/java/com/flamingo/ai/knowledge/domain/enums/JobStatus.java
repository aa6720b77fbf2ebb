package com.flamingo.ai.knowledge.domain.enums;

/** Lifecycle of an ingestion job. */
public enum JobStatus {
  /** Job accepted and waiting for a worker. */
  PENDING,

  /** Pages are being normalized, chunked, embedded or stored. */
  IN_PROGRESS,

  /** All work finished; the summary may still list per-page issues. */
  COMPLETED,

  /** The job could not store its chunks. See the retryable flag. */
  FAILED,

  /** Cancelled by the caller before the write happened. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
