package com.flamingo.ai.knowledge.service.rag.retrieval;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingResult;
import com.flamingo.ai.knowledge.store.ChunkFilter;
import com.flamingo.ai.knowledge.store.ChunkStore;
import com.flamingo.ai.knowledge.store.ScoredChunk;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Embeds a query and runs an owner-scoped similarity search. Stateless. */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private final EmbeddingGenerator embeddingGenerator;
  private final ChunkStore chunkStore;
  private final KnowledgeConfig knowledgeConfig;

  public List<ScoredChunk> retrieve(String ownerId, String queryText, Integer topK) {
    return retrieve(ownerId, queryText, topK, ChunkFilter.none());
  }

  /**
   * Returns the owner's chunks most similar to the query, best first.
   *
   * @param ownerId owner whose chunks are searched
   * @param queryText free-text query
   * @param topK number of hits wanted; null uses the configured default, and the value is clamped
   *     to the configured maximum
   * @param filter extra scalar filters
   * @return ranked hits; empty for a blank query
   */
  @Timed(value = "rag.retrieve", description = "Time to embed a query and search the chunk store")
  public List<ScoredChunk> retrieve(
      String ownerId, String queryText, Integer topK, ChunkFilter filter) {
    if (queryText == null || queryText.isBlank()) {
      return List.of();
    }
    int k = clampTopK(topK);

    EmbeddingResult query = embeddingGenerator.embedQuery(queryText);
    if (query.isDegraded()) {
      log.warn(
          "Query for owner {} embedded with fallback backend, ranking quality reduced: {}",
          ownerId,
          query.reason());
    }

    List<ScoredChunk> hits =
        chunkStore.search(ownerId, query.vector(), k, filter == null ? ChunkFilter.none() : filter);
    List<ScoredChunk> relevant = applyMinScore(hits);
    log.debug(
        "Retrieved {} hits ({} above threshold) for owner {}, topK={}",
        hits.size(),
        relevant.size(),
        ownerId,
        k);
    return relevant;
  }

  int clampTopK(Integer requested) {
    KnowledgeConfig.Retrieval retrieval = knowledgeConfig.getRetrieval();
    int k = requested == null ? retrieval.getTopK() : requested;
    return Math.max(1, Math.min(k, retrieval.getMaxTopK()));
  }

  /** Drops weak hits but always keeps the best one, so a query never comes back empty-handed. */
  private List<ScoredChunk> applyMinScore(List<ScoredChunk> hits) {
    if (hits.isEmpty()) {
      return hits;
    }
    double minScore = knowledgeConfig.getRetrieval().getMinScore();
    List<ScoredChunk> passing = hits.stream().filter(hit -> hit.score() >= minScore).toList();
    if (passing.isEmpty()) {
      log.debug(
          "No hit reached min score {}, keeping best hit with score {}",
          minScore,
          hits.get(0).score());
      return List.of(hits.get(0));
    }
    return passing;
  }
}
