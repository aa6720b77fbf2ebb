package com.flamingo.ai.knowledge.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingResult;
import com.flamingo.ai.knowledge.store.Chunk;
import com.flamingo.ai.knowledge.store.ChunkFilter;
import com.flamingo.ai.knowledge.store.ChunkStore;
import com.flamingo.ai.knowledge.store.ScoredChunk;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("Retriever Tests")
class RetrieverTest {

  private static final List<Float> QUERY_VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private EmbeddingGenerator embeddingGenerator;
  @Mock private ChunkStore chunkStore;

  private KnowledgeConfig knowledgeConfig;
  private Retriever retriever;

  @BeforeEach
  void setUp() {
    knowledgeConfig = new KnowledgeConfig();
    retriever = new Retriever(embeddingGenerator, chunkStore, knowledgeConfig);
  }

  private static ScoredChunk hit(String id, double score) {
    return new ScoredChunk(Chunk.builder().chunkId(id).ownerId("owner").build(), score);
  }

  @Test
  @DisplayName("should return nothing for a blank query without calling any backend")
  void shouldShortCircuitBlankQuery() {
    assertThat(retriever.retrieve("owner", "   ", 5)).isEmpty();
    verifyNoInteractions(embeddingGenerator, chunkStore);
  }

  @ParameterizedTest(name = "requested {0} -> {1}")
  @CsvSource({"1, 1", "7, 7", "0, 1", "-3, 1", "50, 50", "500, 50"})
  @DisplayName("should clamp topK into [1, maxTopK]")
  void shouldClampTopK(int requested, int expected) {
    assertThat(retriever.clampTopK(requested)).isEqualTo(expected);
  }

  @Test
  @DisplayName("should use the configured default when topK is absent")
  void shouldDefaultTopK() {
    assertThat(retriever.clampTopK(null)).isEqualTo(5);
  }

  @Test
  @DisplayName("should search the store with the clamped topK and the owner")
  void shouldPassClampedTopKToStore() {
    when(embeddingGenerator.embedQuery("revenue")).thenReturn(EmbeddingResult.ok(QUERY_VECTOR));
    when(chunkStore.search(eq("owner"), eq(QUERY_VECTOR), anyInt(), any()))
        .thenReturn(List.of(hit("c1", 0.9)));

    List<ScoredChunk> hits = retriever.retrieve("owner", "revenue", 500);

    assertThat(hits).hasSize(1);
    verify(chunkStore).search("owner", QUERY_VECTOR, 50, ChunkFilter.none());
  }

  @Test
  @DisplayName("should drop hits below the minimum score")
  void shouldFilterWeakHits() {
    when(embeddingGenerator.embedQuery("q")).thenReturn(EmbeddingResult.ok(QUERY_VECTOR));
    when(chunkStore.search(eq("owner"), eq(QUERY_VECTOR), anyInt(), any()))
        .thenReturn(List.of(hit("c1", 0.9), hit("c2", 0.5), hit("c3", 0.2)));

    List<ScoredChunk> hits = retriever.retrieve("owner", "q", null);

    assertThat(hits).extracting(h -> h.chunk().getChunkId()).containsExactly("c1", "c2");
  }

  @Test
  @DisplayName("should keep the best hit when nothing reaches the minimum score")
  void shouldKeepBestHitWhenAllWeak() {
    when(embeddingGenerator.embedQuery("q"))
        .thenReturn(EmbeddingResult.degraded(QUERY_VECTOR, "langchain4j: offline"));
    when(chunkStore.search(eq("owner"), eq(QUERY_VECTOR), anyInt(), any()))
        .thenReturn(List.of(hit("c1", 0.2), hit("c2", 0.1)));

    List<ScoredChunk> hits = retriever.retrieve("owner", "q", 3);

    assertThat(hits).extracting(h -> h.chunk().getChunkId()).containsExactly("c1");
  }
}
