package com.flamingo.ai.knowledge.service.rag.retrieval;

import java.util.List;

/**
 * Ranked source groups split for display: {@code primary} is shown expanded, {@code additional} is
 * available on demand.
 */
public record ConsolidatedSources(List<SourceGroup> primary, List<SourceGroup> additional) {

  public static ConsolidatedSources empty() {
    return new ConsolidatedSources(List.of(), List.of());
  }

  public int totalSources() {
    return primary.size() + additional.size();
  }

  public boolean isEmpty() {
    return primary.isEmpty() && additional.isEmpty();
  }
}
