package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.entity.IngestionJob;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.model.IngestionIssue;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for ingestion job status, progress and summary. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionJobResponse {

  private String id;
  private String ownerId;
  private String documentId;
  private JobStatus status;
  private int totalPages;
  private int processedPages;
  private int failedPages;
  private int chunksStored;
  private int degradedChunks;
  private boolean partial;
  private boolean retryable;
  private String errorMessage;
  private List<IngestionIssue> issues;
  private Instant createdAt;
  private Instant startedAt;
  private Instant finishedAt;

  /** Creates an IngestionJobResponse from an IngestionJob entity. */
  public static IngestionJobResponse fromEntity(IngestionJob job) {
    return IngestionJobResponse.builder()
        .id(job.getId())
        .ownerId(job.getOwnerId())
        .documentId(job.getDocumentId())
        .status(job.getStatus())
        .totalPages(job.getTotalPages())
        .processedPages(job.getProcessedPages())
        .failedPages(job.getFailedPages())
        .chunksStored(job.getChunksStored())
        .degradedChunks(job.getDegradedChunks())
        .partial(
            job.getStatus() == JobStatus.COMPLETED && job.getProcessedPages() < job.getTotalPages())
        .retryable(job.getStatus() == JobStatus.FAILED && job.isRetryable())
        .errorMessage(job.getErrorMessage())
        .issues(job.getIssues())
        .createdAt(job.getCreatedAt())
        .startedAt(job.getStartedAt())
        .finishedAt(job.getFinishedAt())
        .build();
  }
}
