package com.flamingo.ai.knowledge.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.api.dto.request.IngestionRequest;
import com.flamingo.ai.knowledge.api.dto.request.PageContent;
import com.flamingo.ai.knowledge.domain.entity.IngestionJob;
import com.flamingo.ai.knowledge.domain.enums.IssueCode;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.model.IngestionIssue;
import com.flamingo.ai.knowledge.domain.repository.IngestionJobRepository;
import com.flamingo.ai.knowledge.domain.source.PlainTextSource;
import com.flamingo.ai.knowledge.service.ingestion.IngestionJobTracker.JobHandle;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.CannotAcquireLockException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("IngestionJobRunner Tests")
class IngestionJobRunnerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Mock private IngestionJobRepository jobRepository;
  @Mock private DocumentIngestionPipeline pipeline;

  private IngestionJobTracker tracker;
  private IngestionJobRunner runner;
  private IngestionJob job;
  private IngestionRequest request;

  @BeforeEach
  void setUp() {
    tracker = new IngestionJobTracker();
    runner =
        new IngestionJobRunner(
            jobRepository, pipeline, tracker, Clock.fixed(NOW, ZoneOffset.UTC));
    job =
        IngestionJob.builder()
            .id("job-1")
            .ownerId("owner")
            .documentId("doc-1")
            .totalPages(2)
            .createdAt(NOW)
            .build();
    request =
        IngestionRequest.builder()
            .documentId("doc-1")
            .source(new PlainTextSource(null))
            .pages(List.of(new PageContent("a", 1), new PageContent("b", 2)))
            .build();
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));
    when(jobRepository.saveAndFlush(any(IngestionJob.class))).thenAnswer(inv -> inv.getArgument(0));
  }

  @Test
  @DisplayName("should record a completed summary on the job")
  void shouldRecordCompletion() {
    IngestionIssue issue =
        IngestionIssue.forChunk(IssueCode.EMBEDDING_BACKEND_UNAVAILABLE, 1, "c1", "offline");
    when(pipeline.ingest(eq("owner"), eq(request), any(JobHandle.class)))
        .thenReturn(
            IngestionSummary.builder()
                .documentId("doc-1")
                .status(JobStatus.COMPLETED)
                .totalPages(2)
                .processedPages(2)
                .chunksStored(3)
                .degradedChunks(1)
                .issues(List.of(issue))
                .build());

    runner.run("job-1", "owner", request);

    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.getStartedAt()).isEqualTo(NOW);
    assertThat(job.getFinishedAt()).isEqualTo(NOW);
    assertThat(job.getChunksStored()).isEqualTo(3);
    assertThat(job.getDegradedChunks()).isEqualTo(1);
    assertThat(job.getIssues()).containsExactly(issue);
    assertThat(tracker.find("job-1")).isEmpty();
  }

  @Test
  @DisplayName("should record a failed summary with its retry hint")
  void shouldRecordFailure() {
    when(pipeline.ingest(eq("owner"), eq(request), any(JobHandle.class)))
        .thenReturn(
            IngestionSummary.builder()
                .documentId("doc-1")
                .status(JobStatus.FAILED)
                .totalPages(2)
                .retryable(true)
                .errorMessage("The document store is temporarily unavailable. Please retry.")
                .build());

    runner.run("job-1", "owner", request);

    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.isRetryable()).isTrue();
    assertThat(job.getErrorMessage()).contains("temporarily unavailable");
  }

  @Test
  @DisplayName("should mark the job failed and retryable when the pipeline throws")
  void shouldRecordUnexpectedError() {
    when(pipeline.ingest(anyString(), any(), any())).thenThrow(new IllegalStateException("boom"));

    runner.run("job-1", "owner", request);

    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.isRetryable()).isTrue();
    assertThat(job.getErrorMessage()).contains("boom");
    assertThat(tracker.find("job-1")).isEmpty();
  }

  @Test
  @DisplayName("should not start a job cancelled while queued")
  void shouldSkipCancelledJob() {
    tracker.register("job-1").cancel();

    runner.run("job-1", "owner", request);

    assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
    verify(pipeline, never()).ingest(anyString(), any(), any());
  }

  @Test
  @DisplayName("should retry job updates on lock contention")
  void shouldRetryOnLockContention() {
    when(pipeline.ingest(anyString(), any(), any()))
        .thenReturn(
            IngestionSummary.builder().documentId("doc-1").status(JobStatus.COMPLETED).build());
    when(jobRepository.saveAndFlush(any(IngestionJob.class)))
        .thenThrow(new CannotAcquireLockException("database is locked"))
        .thenAnswer(inv -> inv.getArgument(0));

    runner.run("job-1", "owner", request);

    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    verify(jobRepository, times(3)).saveAndFlush(any(IngestionJob.class));
  }

  @Test
  @DisplayName("should fail a rejected job as retryable and stop tracking it")
  void shouldRecordRejection() {
    tracker.register("job-1");

    runner.reject("job-1", "Ingestion queue is full, please retry later");

    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.isRetryable()).isTrue();
    assertThat(job.getErrorMessage()).isEqualTo("Ingestion queue is full, please retry later");
    assertThat(tracker.find("job-1")).isEmpty();
    verify(pipeline, never()).ingest(anyString(), any(), any());
  }
}
