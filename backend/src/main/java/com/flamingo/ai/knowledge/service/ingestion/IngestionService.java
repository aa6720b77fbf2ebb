package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.api.dto.request.IngestionRequest;
import com.flamingo.ai.knowledge.api.dto.request.PageContent;
import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.entity.IngestionJob;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.repository.IngestionJobRepository;
import com.flamingo.ai.knowledge.exception.DocumentTooLargeException;
import com.flamingo.ai.knowledge.exception.EmptyDocumentException;
import com.flamingo.ai.knowledge.exception.IngestionJobNotFoundException;
import com.flamingo.ai.knowledge.exception.JobNotCancellableException;
import com.flamingo.ai.knowledge.store.ChunkStats;
import com.flamingo.ai.knowledge.store.ChunkStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Entry point for document ingestion: job submission, polling, cancellation and deletion. */
@Service
@Slf4j
public class IngestionService {

  static final String QUEUE_FULL_MESSAGE = "Ingestion queue is full, please retry later";

  private final IngestionJobRepository jobRepository;
  private final IngestionJobRunner jobRunner;
  private final IngestionJobTracker tracker;
  private final DocumentIngestionPipeline pipeline;
  private final ChunkStore chunkStore;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public IngestionService(
      IngestionJobRepository jobRepository,
      @Lazy IngestionJobRunner jobRunner,
      IngestionJobTracker tracker,
      DocumentIngestionPipeline pipeline,
      ChunkStore chunkStore,
      KnowledgeConfig knowledgeConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
    this.tracker = tracker;
    this.pipeline = pipeline;
    this.chunkStore = chunkStore;
    this.knowledgeConfig = knowledgeConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Validates the request, records a PENDING job and starts it once the job row is committed.
   *
   * @throws EmptyDocumentException if no page has text
   * @throws DocumentTooLargeException if the document exceeds the page or character limit
   */
  @Transactional
  @Timed(value = "document.submit", description = "Time to accept an ingestion job")
  public IngestionJob submit(String ownerId, IngestionRequest request) {
    validate(request);

    IngestionJob job =
        IngestionJob.builder()
            .id(UUID.randomUUID().toString())
            .ownerId(ownerId)
            .documentId(request.getDocumentId())
            .totalPages(request.getPages().size())
            .createdAt(clock.instant())
            .build();
    IngestionJob saved = jobRepository.save(job);
    tracker.register(saved.getId());
    meterRegistry
        .counter("document.submitted", "source", request.getSource().type().getWireName())
        .increment();
    log.info(
        "Accepted job {} for document {} of owner {} ({} pages)",
        saved.getId(),
        request.getDocumentId(),
        ownerId,
        saved.getTotalPages());

    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, dispatching job {}", saved.getId());
              dispatch(saved, ownerId, request);
            }
          });
    } else {
      log.debug("No active transaction, dispatching job {} directly", saved.getId());
      dispatch(saved, ownerId, request);
    }
    return saved;
  }

  /** Hands a job to the executor; a full queue fails the job as retryable. */
  private void dispatch(IngestionJob job, String ownerId, IngestionRequest request) {
    try {
      jobRunner.run(job.getId(), ownerId, request);
    } catch (TaskRejectedException e) {
      meterRegistry.counter("document.submit.rejected").increment();
      jobRunner.reject(job.getId(), QUEUE_FULL_MESSAGE);
      job.fail(QUEUE_FULL_MESSAGE, true, clock.instant());
    }
  }

  /** Runs an ingestion synchronously, without a job record. */
  public IngestionSummary ingestNow(String ownerId, IngestionRequest request) {
    validate(request);
    return pipeline.ingest(ownerId, request, IngestionJobTracker.detached());
  }

  /** Returns a job, with live page counters while it is running. */
  public IngestionJob getJob(String jobId) {
    IngestionJob job =
        jobRepository.findById(jobId).orElseThrow(() -> new IngestionJobNotFoundException(jobId));
    if (!job.isTerminal()) {
      tracker
          .find(jobId)
          .ifPresent(
              handle -> {
                job.setProcessedPages(handle.processedPages());
                job.setFailedPages(handle.failedPages());
              });
    }
    return job;
  }

  public List<IngestionJob> getJobsByOwner(String ownerId) {
    return jobRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
  }

  /**
   * Requests cancellation of a queued or running job. A queued job is cancelled immediately; a
   * running one stops at its next page boundary.
   *
   * @throws JobNotCancellableException if the job already finished
   */
  @Transactional
  public IngestionJob cancel(String jobId) {
    IngestionJob job =
        jobRepository.findById(jobId).orElseThrow(() -> new IngestionJobNotFoundException(jobId));
    if (job.isTerminal()) {
      throw new JobNotCancellableException(jobId, job.getStatus());
    }
    boolean tracked = tracker.requestCancel(jobId);
    if (!tracked || job.getStatus() == JobStatus.PENDING) {
      job.cancel(clock.instant());
      job = jobRepository.save(job);
    }
    log.info("Cancellation requested for job {} (status {})", jobId, job.getStatus());
    return job;
  }

  /** Removes every chunk of a document. */
  @Timed(value = "document.delete", description = "Time to delete a document's chunks")
  public int deleteDocument(String ownerId, String documentId) {
    int deleted = chunkStore.deleteByDocument(ownerId, documentId);
    log.info("Deleted {} chunks of document {} for owner {}", deleted, documentId, ownerId);
    return deleted;
  }

  public ChunkStats stats(String ownerId) {
    return chunkStore.stats(ownerId);
  }

  void validate(IngestionRequest request) {
    List<PageContent> pages = request.getPages();
    String documentId = request.getDocumentId();
    if (pages == null
        || pages.isEmpty()
        || pages.stream().allMatch(p -> p.getText() == null || p.getText().isBlank())) {
      throw new EmptyDocumentException(documentId);
    }
    KnowledgeConfig.Ingestion limits = knowledgeConfig.getIngestion();
    if (pages.size() > limits.getMaxPages()) {
      throw new DocumentTooLargeException(
          documentId,
          "Document " + documentId + " has " + pages.size() + " pages",
          "Document exceeds the maximum of " + limits.getMaxPages() + " pages");
    }
    int characters = request.totalCharacters();
    if (characters > limits.getMaxDocumentChars()) {
      throw new DocumentTooLargeException(
          documentId,
          "Document " + documentId + " has " + characters + " characters",
          "Document exceeds the maximum of " + limits.getMaxDocumentChars() + " characters");
    }
  }
}
