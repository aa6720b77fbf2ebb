package com.flamingo.ai.knowledge.exception;

/** Exception thrown when an ingestion job is not found. */
public class IngestionJobNotFoundException extends RuntimeException {

  private final String jobId;

  public IngestionJobNotFoundException(String jobId) {
    super("Ingestion job not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
