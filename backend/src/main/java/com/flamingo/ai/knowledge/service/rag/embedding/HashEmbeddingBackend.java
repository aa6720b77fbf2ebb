package com.flamingo.ai.knowledge.service.rag.embedding;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Deterministic fallback: signed feature hashing of word unigrams and bigrams into the configured
 * dimension, L2-normalized. Texts sharing vocabulary land close together, which keeps search
 * usable while the model is down. Never fails.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class HashEmbeddingBackend implements EmbeddingBackend {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final HashFunction HASH = Hashing.murmur3_128(0x5eed);

  private final int dimension;

  @Autowired
  public HashEmbeddingBackend(KnowledgeConfig knowledgeConfig) {
    this(knowledgeConfig.getEmbedding().getDimension());
  }

  public HashEmbeddingBackend(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
    }
    this.dimension = dimension;
  }

  @Override
  public String name() {
    return "feature-hash";
  }

  @Override
  public boolean producesDegradedVectors() {
    return true;
  }

  @Override
  public List<List<Float>> embedAll(List<String> texts) {
    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embed(text));
    }
    return vectors;
  }

  List<Float> embed(String text) {
    double[] accumulator = new double[dimension];
    List<String> tokens = tokenize(text);
    if (tokens.isEmpty()) {
      addFeature(accumulator, "raw:" + text, 1.0);
    }
    for (int i = 0; i < tokens.size(); i++) {
      addFeature(accumulator, "w:" + tokens.get(i), 1.0);
      if (i + 1 < tokens.size()) {
        addFeature(accumulator, "b:" + tokens.get(i) + " " + tokens.get(i + 1), 0.5);
      }
    }

    double norm = 0;
    for (double value : accumulator) {
      norm += value * value;
    }
    norm = Math.sqrt(norm);
    List<Float> vector = new ArrayList<>(dimension);
    for (double value : accumulator) {
      vector.add(norm == 0 ? 0f : (float) (value / norm));
    }
    return vector;
  }

  private void addFeature(double[] accumulator, String feature, double weight) {
    long hash = HASH.hashString(feature, StandardCharsets.UTF_8).asLong();
    int index = (int) Math.floorMod(hash, (long) dimension);
    double sign = ((hash >>> 63) & 1L) == 0 ? 1.0 : -1.0;
    accumulator[index] += sign * weight;
  }

  private static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
