package com.flamingo.ai.knowledge.service.rag.embedding;

import com.google.common.base.Suppliers;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.function.Supplier;

/**
 * Process-wide embedding model, built on first use.
 *
 * <p>Concurrent first callers block until the single initialization finishes. A failed
 * initialization is not cached, so a later call tries again.
 */
public class EmbeddingModelProvider {

  private final Supplier<EmbeddingModel> model;

  public EmbeddingModelProvider(Supplier<EmbeddingModel> factory) {
    this.model = Suppliers.memoize(factory::get);
  }

  public EmbeddingModel get() {
    return model.get();
  }
}
