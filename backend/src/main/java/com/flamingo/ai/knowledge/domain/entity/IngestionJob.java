package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.converter.IngestionIssueListConverter;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.model.IngestionIssue;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** An asynchronous ingestion of one document, polled by the caller through its id. */
@Entity
@Table(
    name = "ingestion_jobs",
    indexes = {
      @Index(name = "idx_ingestion_jobs_owner", columnList = "ownerId"),
      @Index(name = "idx_ingestion_jobs_status", columnList = "status")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionJob {

  @Id private String id;

  @Column(nullable = false)
  private String ownerId;

  @Column(nullable = false)
  private String documentId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private JobStatus status = JobStatus.PENDING;

  private int totalPages;
  private int processedPages;
  private int failedPages;
  private int chunksStored;
  private int degradedChunks;

  /** Whether resubmitting the same request may succeed. Only meaningful when FAILED. */
  private boolean retryable;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Convert(converter = IngestionIssueListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<IngestionIssue> issues = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  private Instant startedAt;
  private Instant finishedAt;

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /** Marks the job as running. */
  public void start(Instant now) {
    this.status = JobStatus.IN_PROGRESS;
    this.startedAt = now;
  }

  /** Marks the job as failed; {@code retryable} tells the caller whether to resubmit. */
  public void fail(String message, boolean retryable, Instant now) {
    this.status = JobStatus.FAILED;
    this.errorMessage = message;
    this.retryable = retryable;
    this.finishedAt = now;
  }

  /** Marks the job as cancelled. */
  public void cancel(Instant now) {
    this.status = JobStatus.CANCELLED;
    this.finishedAt = now;
  }
}
