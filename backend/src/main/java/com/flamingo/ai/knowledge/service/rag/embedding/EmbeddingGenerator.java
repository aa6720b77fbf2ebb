package com.flamingo.ai.knowledge.service.rag.embedding;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Maps texts to vectors of the configured dimension through an ordered chain of backends.
 *
 * <p>Each batch goes to the first backend; on failure, or on a wrong output shape, the next one is
 * tried. Vectors from anything but a healthy primary are returned as {@link
 * EmbeddingStatus#DEGRADED} with the primary's failure as reason. Never throws while the last
 * backend can answer. Safe for concurrent use: holds no mutable state of its own.
 */
@Service
@Slf4j
public class EmbeddingGenerator {

  private final List<EmbeddingBackend> backends;
  private final MeterRegistry meterRegistry;
  private final int dimension;
  private final int batchSize;

  @Autowired
  public EmbeddingGenerator(
      List<EmbeddingBackend> backends,
      KnowledgeConfig knowledgeConfig,
      MeterRegistry meterRegistry) {
    this(
        backends,
        meterRegistry,
        knowledgeConfig.getEmbedding().getDimension(),
        knowledgeConfig.getEmbedding().getBatchSize());
  }

  public EmbeddingGenerator(
      List<EmbeddingBackend> backends, MeterRegistry meterRegistry, int dimension, int batchSize) {
    if (backends.isEmpty()) {
      throw new IllegalArgumentException("At least one embedding backend is required");
    }
    this.backends = List.copyOf(backends);
    this.meterRegistry = meterRegistry;
    this.dimension = dimension;
    this.batchSize = Math.max(1, batchSize);
  }

  public int dimension() {
    return dimension;
  }

  /**
   * Embeds all texts. Results are in input order.
   *
   * @param texts texts to embed
   * @return one tagged result per text
   */
  @Timed(value = "embedding.generate", description = "Time to embed a batch of texts")
  public List<EmbeddingResult> embed(List<String> texts) {
    List<EmbeddingResult> results = new ArrayList<>(texts.size());
    for (int start = 0; start < texts.size(); start += batchSize) {
      List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
      results.addAll(embedBatch(batch));
    }
    return results;
  }

  public EmbeddingResult embedQuery(String query) {
    return embed(List.of(query)).get(0);
  }

  private List<EmbeddingResult> embedBatch(List<String> batch) {
    String primaryFailure = null;
    for (int i = 0; i < backends.size(); i++) {
      EmbeddingBackend backend = backends.get(i);
      List<List<Float>> vectors;
      try {
        vectors = backend.embedAll(batch);
        checkShape(backend, vectors, batch.size());
      } catch (RuntimeException e) {
        log.warn(
            "EmbeddingBackendUnavailable: backend '{}' failed for {} texts: {}",
            backend.name(),
            batch.size(),
            e.getMessage());
        meterRegistry.counter("embedding.backend.failure", "backend", backend.name()).increment();
        if (primaryFailure == null) {
          primaryFailure = backend.name() + ": " + e.getMessage();
        }
        continue;
      }

      boolean degraded = i > 0 || backend.producesDegradedVectors();
      List<EmbeddingResult> results = new ArrayList<>(vectors.size());
      for (List<Float> vector : vectors) {
        results.add(
            degraded
                ? EmbeddingResult.degraded(vector, reasonOrDefault(primaryFailure, backend))
                : EmbeddingResult.ok(vector));
      }
      meterRegistry
          .counter(degraded ? "embedding.requests.degraded" : "embedding.requests.success")
          .increment(batch.size());
      return results;
    }
    throw new IllegalStateException(
        "No embedding backend could embed the batch; last failure: " + primaryFailure);
  }

  private void checkShape(EmbeddingBackend backend, List<List<Float>> vectors, int expected) {
    if (vectors == null || vectors.size() != expected) {
      throw new IllegalStateException(
          String.format(
              "backend '%s' returned %d vectors for %d texts",
              backend.name(), vectors == null ? 0 : vectors.size(), expected));
    }
    for (List<Float> vector : vectors) {
      if (vector == null || vector.size() != dimension) {
        throw new IllegalStateException(
            String.format(
                "backend '%s' returned dimension %d, expected %d",
                backend.name(), vector == null ? 0 : vector.size(), dimension));
      }
    }
  }

  private static String reasonOrDefault(String primaryFailure, EmbeddingBackend backend) {
    return primaryFailure != null
        ? primaryFailure
        : "only fallback backend '" + backend.name() + "' is configured";
  }
}
