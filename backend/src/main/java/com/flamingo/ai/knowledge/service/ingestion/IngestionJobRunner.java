package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.api.dto.request.IngestionRequest;
import com.flamingo.ai.knowledge.domain.entity.IngestionJob;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.repository.IngestionJobRepository;
import com.flamingo.ai.knowledge.exception.IngestionJobNotFoundException;
import com.flamingo.ai.knowledge.service.ingestion.IngestionJobTracker.JobHandle;
import java.time.Clock;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Executes submitted ingestion jobs on the ingestion executor and records their outcome. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionJobRunner {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final IngestionJobRepository jobRepository;
  private final DocumentIngestionPipeline pipeline;
  private final IngestionJobTracker tracker;
  private final Clock clock;

  /**
   * Runs a job to completion. Never throws: every outcome, including unexpected errors, ends up on
   * the job record.
   */
  @Async("ingestionExecutor")
  public void run(String jobId, String ownerId, IngestionRequest request) {
    JobHandle handle = tracker.register(jobId);
    try {
      IngestionJob job = jobRepository.findById(jobId).orElse(null);
      if (job == null || job.isTerminal() || handle.isCancelled()) {
        log.info("Skipping job {}: cancelled or already finished", jobId);
        if (job != null && !job.isTerminal()) {
          updateJob(jobId, j -> j.cancel(clock.instant()));
        }
        return;
      }

      updateJob(jobId, j -> j.start(clock.instant()));
      log.info("Job {} started for document {}", jobId, request.getDocumentId());

      IngestionSummary summary = pipeline.ingest(ownerId, request, handle);
      updateJob(jobId, j -> applySummary(j, summary));
      log.info(
          "Job {} finished with status {} ({} chunks, {} issues)",
          jobId,
          summary.status(),
          summary.chunksStored(),
          summary.issues().size());
    } catch (Exception e) {
      log.error("Job {} failed unexpectedly: {}", jobId, e.getMessage(), e);
      try {
        updateJob(jobId, j -> j.fail("Unexpected error: " + e.getMessage(), true, clock.instant()));
      } catch (Exception updateEx) {
        log.error("Failed to record failure of job {}: {}", jobId, updateEx.getMessage());
      }
    } finally {
      tracker.remove(jobId);
    }
  }

  /**
   * Records a job the executor refused to accept as failed and retryable. Runs in its own
   * transaction because it is called after the submitting transaction has committed.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void reject(String jobId, String reason) {
    try {
      updateJob(jobId, j -> j.fail(reason, true, clock.instant()));
      log.warn("Job {} rejected: {}", jobId, reason);
    } finally {
      tracker.remove(jobId);
    }
  }

  private void applySummary(IngestionJob job, IngestionSummary summary) {
    job.setProcessedPages(summary.processedPages());
    job.setFailedPages(summary.failedPages());
    job.setChunksStored(summary.chunksStored());
    job.setDegradedChunks(summary.degradedChunks());
    job.setIssues(summary.issues());
    if (summary.status() == JobStatus.FAILED) {
      job.fail(summary.errorMessage(), summary.retryable(), clock.instant());
    } else if (summary.status() == JobStatus.CANCELLED) {
      job.cancel(clock.instant());
    } else {
      job.setStatus(JobStatus.COMPLETED);
      job.setFinishedAt(clock.instant());
    }
  }

  /** Loads, mutates and saves a job, retrying on SQLite lock contention. */
  private void updateJob(String jobId, Consumer<IngestionJob> mutation) {
    for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
      try {
        IngestionJob job =
            jobRepository
                .findById(jobId)
                .orElseThrow(() -> new IngestionJobNotFoundException(jobId));
        mutation.accept(job);
        jobRepository.saveAndFlush(job);
        return;
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update job {} after {} retries", jobId, MAX_RETRIES);
          throw e;
        }
        log.warn("SQLite lock contention on job {}, retry {}/{}", jobId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }
}
