package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.model.IngestionIssue;
import java.util.List;
import lombok.Builder;

/**
 * Outcome of ingesting one document. {@code processedPages < totalPages} means the document was
 * ingested partially; the issues say why.
 */
@Builder
public record IngestionSummary(
    String documentId,
    JobStatus status,
    int totalPages,
    int processedPages,
    int failedPages,
    int chunksStored,
    int degradedChunks,
    int chunksPruned,
    boolean retryable,
    String errorMessage,
    List<IngestionIssue> issues) {

  public IngestionSummary {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public boolean isPartial() {
    return status == JobStatus.COMPLETED && processedPages < totalPages;
  }
}
