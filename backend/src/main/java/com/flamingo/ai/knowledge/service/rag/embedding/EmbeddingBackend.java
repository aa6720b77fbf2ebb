package com.flamingo.ai.knowledge.service.rag.embedding;

import java.util.List;

/** One link in the embedding fallback chain. */
public interface EmbeddingBackend {

  String name();

  /**
   * Embeds every text in one call.
   *
   * @param texts non-empty batch
   * @return one vector per text, in input order
   * @throws RuntimeException when the backend is unavailable; the chain moves on to the next one
   */
  List<List<Float>> embedAll(List<String> texts);

  /** Whether vectors from this backend should be re-embedded once the primary recovers. */
  default boolean producesDegradedVectors() {
    return false;
  }
}
