package com.flamingo.ai.knowledge.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4jEmbeddingBackend Tests")
class LangChain4jEmbeddingBackendTest {

  @Mock private EmbeddingModel embeddingModel;

  @Test
  @DisplayName("should embed all texts in one model call")
  void shouldEmbedInOneCall() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(
                    Embedding.from(new float[] {0.1f, 0.2f}),
                    Embedding.from(new float[] {0.3f, 0.4f}))));
    LangChain4jEmbeddingBackend backend =
        new LangChain4jEmbeddingBackend(new EmbeddingModelProvider(() -> embeddingModel));

    List<List<Float>> vectors = backend.embedAll(List.of("a", "b"));

    assertThat(vectors).containsExactly(List.of(0.1f, 0.2f), List.of(0.3f, 0.4f));
    verify(embeddingModel, times(1)).embedAll(anyList());
  }

  @Test
  @DisplayName("should truncate texts longer than the model limit")
  @SuppressWarnings("unchecked")
  void shouldTruncateLongTexts() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));
    LangChain4jEmbeddingBackend backend =
        new LangChain4jEmbeddingBackend(new EmbeddingModelProvider(() -> embeddingModel));

    backend.embedAll(List.of("x".repeat(LangChain4jEmbeddingBackend.MAX_CHARS_PER_EMBEDDING + 10)));

    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(captor.capture());
    assertThat(captor.getValue().get(0).text())
        .hasSize(LangChain4jEmbeddingBackend.MAX_CHARS_PER_EMBEDDING);
  }

  @Test
  @DisplayName("should fail when the model returns no content")
  void shouldFailOnEmptyResponse() {
    when(embeddingModel.embedAll(anyList())).thenReturn(null);
    LangChain4jEmbeddingBackend backend =
        new LangChain4jEmbeddingBackend(new EmbeddingModelProvider(() -> embeddingModel));

    assertThatThrownBy(() -> backend.embedAll(List.of("a")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should build the model once under concurrent first use")
  void shouldInitializeModelOnce() throws Exception {
    AtomicInteger builds = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    EmbeddingModelProvider provider =
        new EmbeddingModelProvider(
            () -> {
              builds.incrementAndGet();
              return embeddingModel;
            });

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<CompletableFuture<EmbeddingModel>> futures =
          java.util.stream.IntStream.range(0, 8)
              .mapToObj(
                  i ->
                      CompletableFuture.supplyAsync(
                          () -> {
                            try {
                              start.await();
                            } catch (InterruptedException e) {
                              Thread.currentThread().interrupt();
                            }
                            return provider.get();
                          },
                          pool))
              .toList();
      start.countDown();
      for (CompletableFuture<EmbeddingModel> future : futures) {
        assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(embeddingModel);
      }
    } finally {
      pool.shutdownNow();
    }
    assertThat(builds.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("should retry model construction after a failed first attempt")
  void shouldNotCacheInitializationFailure() {
    AtomicInteger attempts = new AtomicInteger();
    EmbeddingModelProvider provider =
        new EmbeddingModelProvider(
            () -> {
              if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("API key missing");
              }
              return embeddingModel;
            });

    assertThatThrownBy(provider::get).isInstanceOf(IllegalStateException.class);
    assertThat(provider.get()).isSameAs(embeddingModel);
  }
}
