package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.domain.enums.SourceType;
import java.util.Set;

/**
 * Scalar filters applied on top of the mandatory owner scope. Empty sets mean "no restriction".
 */
public record ChunkFilter(Set<String> documentIds, Set<SourceType> sourceTypes, Double minScore) {

  private static final ChunkFilter NONE = new ChunkFilter(Set.of(), Set.of(), null);

  public ChunkFilter {
    documentIds = documentIds == null ? Set.of() : Set.copyOf(documentIds);
    sourceTypes = sourceTypes == null ? Set.of() : Set.copyOf(sourceTypes);
  }

  public static ChunkFilter none() {
    return NONE;
  }

  /** Whether the chunk passes the document and source type filters. */
  public boolean matches(Chunk chunk) {
    if (!documentIds.isEmpty() && !documentIds.contains(chunk.getDocumentId())) {
      return false;
    }
    return sourceTypes.isEmpty() || sourceTypes.contains(chunk.getSourceType());
  }

  public boolean acceptsScore(double score) {
    return minScore == null || score >= minScore;
  }
}
