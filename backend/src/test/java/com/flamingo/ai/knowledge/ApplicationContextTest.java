package com.flamingo.ai.knowledge;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledge.api.dto.request.IngestionRequest;
import com.flamingo.ai.knowledge.api.dto.request.PageContent;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.source.PlainTextSource;
import com.flamingo.ai.knowledge.service.ingestion.IngestionService;
import com.flamingo.ai.knowledge.service.ingestion.IngestionSummary;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.knowledge.service.rag.retrieval.KnowledgeSearchService;
import com.flamingo.ai.knowledge.service.rag.retrieval.KnowledgeSearchService.SearchResult;
import com.flamingo.ai.knowledge.store.ChunkStore;
import com.flamingo.ai.knowledge.store.JdbcChunkStore;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the application context loads against the SQLite test database. The embedding model is
 * mocked and returns nothing, so every chunk goes through the hash fallback.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;
  @Autowired private IngestionService ingestionService;
  @Autowired private KnowledgeSearchService knowledgeSearchService;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(IngestionService.class)).isNotNull();
    assertThat(applicationContext.getBean(KnowledgeSearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(EmbeddingGenerator.class)).isNotNull();
    assertThat(applicationContext.getBean(ChunkStore.class)).isInstanceOf(JdbcChunkStore.class);
  }

  @Test
  @DisplayName("Documents ingested with degraded embeddings should still be searchable")
  void shouldIngestAndSearchWithFallbackEmbeddings() {
    String ownerId = "ctx-" + UUID.randomUUID();
    IngestionSummary revenue =
        ingestionService.ingestNow(ownerId, request("revenue", "Quarterly revenue report."));
    ingestionService.ingestNow(ownerId, request("bread", "Sourdough bread needs patience."));

    assertThat(revenue.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(revenue.degradedChunks()).isEqualTo(revenue.chunksStored()).isPositive();

    SearchResult result = knowledgeSearchService.search(ownerId, "quarterly revenue", null, true);

    assertThat(result.sources().primary()).isNotEmpty();
    assertThat(result.sources().primary().get(0).documentId()).isEqualTo("revenue");
    assertThat(ingestionService.stats(ownerId).documents()).isEqualTo(2);
  }

  private static IngestionRequest request(String documentId, String text) {
    return IngestionRequest.builder()
        .documentId(documentId)
        .source(new PlainTextSource(documentId))
        .pages(List.of(PageContent.builder().text(text).build()))
        .build();
  }
}
