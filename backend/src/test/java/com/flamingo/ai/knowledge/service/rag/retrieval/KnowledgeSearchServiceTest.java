package com.flamingo.ai.knowledge.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.exception.ChunkStoreException;
import com.flamingo.ai.knowledge.exception.SearchException;
import com.flamingo.ai.knowledge.service.rag.retrieval.KnowledgeSearchService.SearchResult;
import com.flamingo.ai.knowledge.store.Chunk;
import com.flamingo.ai.knowledge.store.ScoredChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("KnowledgeSearchService Tests")
class KnowledgeSearchServiceTest {

  @Mock private Retriever retriever;

  private SimpleMeterRegistry meterRegistry;
  private KnowledgeSearchService searchService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    searchService =
        new KnowledgeSearchService(
            retriever,
            new ResultConsolidator(),
            new QueryHighlighter(),
            new KnowledgeConfig(),
            meterRegistry);
  }

  private static ScoredChunk hit(String documentId, String text, double score) {
    Chunk chunk =
        Chunk.builder()
            .chunkId(documentId + "-" + score)
            .ownerId("owner")
            .documentId(documentId)
            .sourceType(SourceType.UPLOADED_FILE)
            .sourceTitle(documentId + ".pdf")
            .text(text)
            .build();
    return new ScoredChunk(chunk, score);
  }

  @Test
  @DisplayName("should split consolidated sources into primary and additional")
  void shouldConsolidateAndSplit() {
    when(retriever.retrieve(eq("owner"), eq("budget"), isNull(), any()))
        .thenReturn(
            List.of(
                hit("plan", "Budget plan", 0.9),
                hit("memo", "Budget memo", 0.8),
                hit("plan", "Budget appendix", 0.7),
                hit("notes", "Meeting notes", 0.6)));

    SearchResult result = searchService.search("owner", "budget", null, false);

    assertThat(result.query()).isEqualTo("budget");
    assertThat(result.sources().primary())
        .extracting(SourceGroup::displayName)
        .containsExactly("plan.pdf", "memo.pdf");
    assertThat(result.sources().additional())
        .extracting(SourceGroup::displayName)
        .containsExactly("notes.pdf");
    assertThat(result.sources().primary().get(0).highlightedText()).isNull();
    assertThat(meterRegistry.counter("rag.search.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should add highlighted text when requested")
  void shouldHighlight() {
    when(retriever.retrieve(eq("owner"), eq("budget"), eq(3), any()))
        .thenReturn(List.of(hit("plan", "The budget plan", 0.9)));

    SearchResult result = searchService.search("owner", "budget", 3, true);

    SourceGroup group = result.sources().primary().get(0);
    assertThat(group.text()).isEqualTo("The budget plan");
    assertThat(group.highlightedText()).isEqualTo("The **budget** plan");
  }

  @Test
  @DisplayName("should report a store failure as a search failure")
  void shouldWrapStoreFailure() {
    when(retriever.retrieve(eq("owner"), eq("budget"), isNull(), any()))
        .thenThrow(new ChunkStoreException("down", new SQLException("locked")));

    assertThatThrownBy(() -> searchService.search("owner", "budget", null, false))
        .isInstanceOf(SearchException.class)
        .hasCauseInstanceOf(ChunkStoreException.class);
    assertThat(meterRegistry.counter("rag.search.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should return empty sources when nothing matches")
  void shouldReturnEmptySources() {
    when(retriever.retrieve(eq("owner"), eq("nothing"), isNull(), any())).thenReturn(List.of());

    SearchResult result = searchService.search("owner", "nothing", null, true);

    assertThat(result.sources().isEmpty()).isTrue();
  }
}
