package com.flamingo.ai.knowledge.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.knowledge.domain.enums.IssueCode;

/**
 * A non-fatal problem met while ingesting a document.
 *
 * @param code kind of problem
 * @param pageNumber page the problem relates to, if any
 * @param chunkId chunk the problem relates to, if any
 * @param message human-readable detail
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionIssue(IssueCode code, Integer pageNumber, String chunkId, String message) {

  public static IngestionIssue forPage(IssueCode code, Integer pageNumber, String message) {
    return new IngestionIssue(code, pageNumber, null, message);
  }

  public static IngestionIssue forChunk(
      IssueCode code, Integer pageNumber, String chunkId, String message) {
    return new IngestionIssue(code, pageNumber, chunkId, message);
  }
}
