package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.exception.ChunkStoreException;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingResult;
import com.flamingo.ai.knowledge.store.Chunk;
import com.flamingo.ai.knowledge.store.ChunkStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-embeds chunks that were stored with a fallback vector once the primary embedding backend
 * serves again.
 */
@Component
@ConditionalOnProperty(
    name = "knowledge.ingestion.repair-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DegradedEmbeddingRepairJob {

  private static final int MAX_BATCHES_PER_RUN = 20;

  private final ChunkStore chunkStore;
  private final EmbeddingGenerator embeddingGenerator;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      fixedDelayString = "${knowledge.ingestion.repair-interval:PT10M}",
      initialDelayString = "${knowledge.ingestion.repair-interval:PT10M}")
  public void scheduledRepair() {
    try {
      repair();
    } catch (ChunkStoreException e) {
      log.warn("Degraded embedding repair skipped, store unavailable: {}", e.getMessage());
    }
  }

  /**
   * Repairs degraded chunks batch by batch. Stops when the primary backend still serves nothing or
   * nothing is left. Only the embedding and the degraded flag are written, and only for chunks not
   * rewritten since they were read.
   *
   * @return number of chunks repaired
   */
  public int repair() {
    int batchSize = knowledgeConfig.getIngestion().getRepairBatchSize();
    int repaired = 0;
    int skipped = 0;
    for (int batch = 0; batch < MAX_BATCHES_PER_RUN; batch++) {
      List<Chunk> degraded = chunkStore.findDegraded(batchSize);
      if (degraded.isEmpty()) {
        break;
      }
      BatchOutcome outcome = repairBatch(degraded);
      repaired += outcome.replaced();
      skipped += outcome.stale();
      if (outcome.replaced() == 0 || outcome.replaced() + outcome.stale() < degraded.size()) {
        break;
      }
    }
    if (skipped > 0) {
      log.debug("Skipped {} degraded chunks rewritten during repair", skipped);
    }
    if (repaired > 0) {
      log.info("Repaired {} degraded embeddings", repaired);
      meterRegistry.counter("embedding.repair.success").increment(repaired);
    }
    return repaired;
  }

  private record BatchOutcome(int replaced, int stale) {}

  private BatchOutcome repairBatch(List<Chunk> degraded) {
    List<EmbeddingResult> results =
        embeddingGenerator.embed(degraded.stream().map(Chunk::getText).toList());

    int replaced = 0;
    int stale = 0;
    int served = 0;
    for (int i = 0; i < degraded.size(); i++) {
      EmbeddingResult result = results.get(i);
      if (result.isDegraded()) {
        continue;
      }
      served++;
      Chunk chunk = degraded.get(i);
      boolean applied =
          chunkStore.replaceDegradedEmbedding(
              chunk.getOwnerId(), chunk.getChunkId(), chunk.getText(), result.vector());
      if (applied) {
        replaced++;
      } else {
        stale++;
      }
    }
    if (served == 0) {
      log.debug(
          "Primary embedding backend still unavailable, {} chunks stay degraded", degraded.size());
    }
    return new BatchOutcome(replaced, stale);
  }
}
