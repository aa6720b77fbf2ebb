package com.flamingo.ai.knowledge.service.ingestion;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * In-memory state of jobs that are queued or running: the cooperative cancellation flag and live
 * page counters. Entries are removed once the job reaches a terminal state.
 */
@Component
public class IngestionJobTracker {

  private final Map<String, JobHandle> active = new ConcurrentHashMap<>();

  public JobHandle register(String jobId) {
    return active.computeIfAbsent(jobId, id -> new JobHandle());
  }

  public Optional<JobHandle> find(String jobId) {
    return Optional.ofNullable(active.get(jobId));
  }

  /**
   * Requests cancellation. The job stops at its next page boundary.
   *
   * @return false when the job is not tracked
   */
  public boolean requestCancel(String jobId) {
    JobHandle handle = active.get(jobId);
    if (handle == null) {
      return false;
    }
    handle.cancel();
    return true;
  }

  public void remove(String jobId) {
    active.remove(jobId);
  }

  /** A handle for work that is not backed by a job, such as synchronous ingestion. */
  public static JobHandle detached() {
    return new JobHandle();
  }

  /** Shared between the job runner, its page workers and whoever polls or cancels the job. */
  public static final class JobHandle {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger processedPages = new AtomicInteger();
    private final AtomicInteger failedPages = new AtomicInteger();

    public void cancel() {
      cancelled.set(true);
    }

    public boolean isCancelled() {
      return cancelled.get();
    }

    public void pageProcessed() {
      processedPages.incrementAndGet();
    }

    public void pageFailed() {
      failedPages.incrementAndGet();
    }

    public int processedPages() {
      return processedPages.get();
    }

    public int failedPages() {
      return failedPages.get();
    }
  }
}
