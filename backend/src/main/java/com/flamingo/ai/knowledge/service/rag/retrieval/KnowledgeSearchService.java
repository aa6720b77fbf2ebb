package com.flamingo.ai.knowledge.service.rag.retrieval;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.exception.ChunkStoreException;
import com.flamingo.ai.knowledge.exception.SearchException;
import com.flamingo.ai.knowledge.store.ChunkFilter;
import com.flamingo.ai.knowledge.store.ScoredChunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Query entry point for answer generation and the REST API: retrieve, consolidate by source,
 * optionally highlight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSearchService {

  private final Retriever retriever;
  private final ResultConsolidator resultConsolidator;
  private final QueryHighlighter queryHighlighter;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;

  /** Outcome of a search: the query and its source groups split for display. */
  public record SearchResult(String query, ConsolidatedSources sources) {}

  public SearchResult search(String ownerId, String query, Integer topK, boolean highlight) {
    return search(ownerId, query, topK, highlight, ChunkFilter.none());
  }

  @Timed(value = "rag.search", description = "Time to retrieve and consolidate sources")
  public SearchResult search(
      String ownerId, String query, Integer topK, boolean highlight, ChunkFilter filter) {
    List<ScoredChunk> hits;
    try {
      hits = retriever.retrieve(ownerId, query, topK, filter);
    } catch (ChunkStoreException e) {
      meterRegistry.counter("rag.search.failure").increment();
      throw new SearchException("Search failed for owner " + ownerId, e);
    }

    List<SourceGroup> groups = resultConsolidator.consolidate(hits);
    if (highlight) {
      String marker = knowledgeConfig.getRetrieval().getHighlightMarker();
      groups =
          groups.stream()
              .map(
                  group ->
                      group.withHighlightedText(
                          queryHighlighter.highlight(group.text(), query, marker)))
              .toList();
    }

    ConsolidatedSources sources =
        resultConsolidator.present(groups, knowledgeConfig.getRetrieval().getPrimaryGroups());
    meterRegistry.counter("rag.search.success").increment();
    log.debug(
        "Search for owner {} returned {} sources from {} hits",
        ownerId,
        sources.totalSources(),
        hits.size());
    return new SearchResult(query, sources);
  }
}
