package com.flamingo.ai.knowledge.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HashEmbeddingBackend Tests")
class HashEmbeddingBackendTest {

  private final HashEmbeddingBackend backend = new HashEmbeddingBackend(256);

  @Test
  @DisplayName("should be deterministic and unit-length")
  void shouldBeDeterministicAndNormalized() {
    List<Float> first = backend.embed("The quick brown fox");
    List<Float> second = backend.embed("The quick brown fox");

    assertThat(first).hasSize(256).isEqualTo(second);
    assertThat(norm(first)).isCloseTo(1.0, org.assertj.core.data.Offset.offset(1e-5));
  }

  @Test
  @DisplayName("should score overlapping texts higher than unrelated ones")
  void shouldPreserveLexicalSimilarity() {
    List<Float> query = backend.embed("database connection pool settings");
    List<Float> related = backend.embed("tuning the database connection pool");
    List<Float> unrelated = backend.embed("recipes for sourdough bread");

    assertThat(dot(query, related)).isGreaterThan(dot(query, unrelated));
  }

  @Test
  @DisplayName("should ignore case and punctuation")
  void shouldNormalizeTokens() {
    assertThat(backend.embed("Hello, World!")).isEqualTo(backend.embed("hello world"));
  }

  @Test
  @DisplayName("should produce a non-zero vector for text without word characters")
  void shouldHandleSymbolOnlyText() {
    assertThat(norm(backend.embed("+++"))).isGreaterThan(0.0);
  }

  @Test
  @DisplayName("should report its vectors as degraded")
  void shouldReportDegraded() {
    assertThat(backend.producesDegradedVectors()).isTrue();
    assertThat(backend.embedAll(List.of("a", "b"))).hasSize(2);
  }

  @Test
  @DisplayName("should reject non-positive dimensions")
  void shouldRejectInvalidDimension() {
    assertThatThrownBy(() -> new HashEmbeddingBackend(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static double norm(List<Float> vector) {
    return Math.sqrt(dot(vector, vector));
  }

  private static double dot(List<Float> a, List<Float> b) {
    double sum = 0;
    for (int i = 0; i < a.size(); i++) {
      sum += a.get(i) * b.get(i);
    }
    return sum;
  }
}
