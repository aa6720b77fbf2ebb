package com.flamingo.ai.knowledge.service.rag.embedding;

import java.util.List;

/**
 * Vector for one input text, tagged with where it came from.
 *
 * @param vector vector of the configured dimension
 * @param status {@link EmbeddingStatus#DEGRADED} when a fallback backend produced it
 * @param reason why the primary backend was not used; null when {@code status} is OK
 */
public record EmbeddingResult(List<Float> vector, EmbeddingStatus status, String reason) {

  public static EmbeddingResult ok(List<Float> vector) {
    return new EmbeddingResult(vector, EmbeddingStatus.OK, null);
  }

  public static EmbeddingResult degraded(List<Float> vector, String reason) {
    return new EmbeddingResult(vector, EmbeddingStatus.DEGRADED, reason);
  }

  public boolean isDegraded() {
    return status == EmbeddingStatus.DEGRADED;
  }
}
