package com.flamingo.ai.knowledge.config;

import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingModelProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>The model bean is lazy: a missing API key does not stop the application from starting, it
 * only makes the primary embedding backend unavailable until the key is configured.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${knowledge.embedding.dimension:1536}")
  private int embeddingDimensions;

  @Bean
  @Lazy
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  @Bean
  public EmbeddingModelProvider embeddingModelProvider(ObjectProvider<EmbeddingModel> model) {
    return new EmbeddingModelProvider(model::getObject);
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
