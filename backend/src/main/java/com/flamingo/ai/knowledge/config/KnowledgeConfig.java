package com.flamingo.ai.knowledge.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for ingestion, chunking, embedding and retrieval. */
@Configuration
@ConfigurationProperties(prefix = "knowledge")
@Getter
@Setter
public class KnowledgeConfig {

  private Embedding embedding = new Embedding();
  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Ingestion ingestion = new Ingestion();
  private Store store = new Store();

  @Getter
  @Setter
  public static class Embedding {
    /** Vector dimension shared by every chunk in the store. Fixed at deployment time. */
    private int dimension = 1536;

    /** Maximum number of texts sent to the model in one request. */
    private int batchSize = 64;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int maxSize = 2000;
    private int overlap = 200;

    /** Overlap actually applied; never more than half of {@code maxSize}. */
    public int effectiveOverlap() {
      return Math.max(0, Math.min(overlap, maxSize / 2));
    }
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private int maxTopK = 50;

    /** Hits scoring below this are dropped, unless nothing passes (then the best hit is kept). */
    private double minScore = 0.3;

    /** Number of source groups shown expanded by default. */
    private int primaryGroups = 2;

    private String highlightMarker = "**";
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Page worker pool size; 0 derives min(cpu cores, 4). */
    private int workerPoolSize = 0;

    private int maxDocumentChars = 10 * 1024 * 1024;
    private int maxPages = 2000;

    private boolean repairEnabled = true;
    private int repairBatchSize = 50;
    private Duration repairInterval = Duration.ofMinutes(10);

    public int effectiveWorkerPoolSize() {
      if (workerPoolSize > 0) {
        return workerPoolSize;
      }
      return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 4));
    }
  }

  @Getter
  @Setter
  public static class Store {
    /** Chunk store backend: "jdbc" (SQLite, default) or "elasticsearch". */
    private String backend = "jdbc";

    private String tableName = "document_chunks";
    private String indexName = "knowledge-chunks";
  }
}
