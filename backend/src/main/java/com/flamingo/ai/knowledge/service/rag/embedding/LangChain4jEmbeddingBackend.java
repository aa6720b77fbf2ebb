package com.flamingo.ai.knowledge.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Primary backend: the configured LangChain4j embedding model. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingBackend implements EmbeddingBackend {

  // text-embedding-3 accepts 8191 tokens; stay well below it.
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModelProvider modelProvider;

  @Override
  public String name() {
    return "langchain4j";
  }

  @Override
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public List<List<Float>> embedAll(List<String> texts) {
    EmbeddingModel model = modelProvider.get();
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(truncate(text)));
    }
    Response<List<Embedding>> response = model.embedAll(segments);
    if (response == null || response.content() == null) {
      throw new IllegalStateException("Embedding model returned no content");
    }
    List<List<Float>> vectors = new ArrayList<>(response.content().size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vectorAsList());
    }
    log.debug("Embedded {} texts with {}", texts.size(), name());
    return vectors;
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding ({} chars), truncating to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }
}
