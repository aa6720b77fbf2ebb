package com.flamingo.ai.knowledge.exception;

import com.flamingo.ai.knowledge.domain.enums.JobStatus;

/** Thrown when cancelling a job that already reached a terminal state. */
public class JobNotCancellableException extends RuntimeException {

  private final String jobId;
  private final JobStatus status;

  public JobNotCancellableException(String jobId, JobStatus status) {
    super("Job " + jobId + " cannot be cancelled in status " + status);
    this.jobId = jobId;
    this.status = status;
  }

  public String getJobId() {
    return jobId;
  }

  public JobStatus getStatus() {
    return status;
  }
}
