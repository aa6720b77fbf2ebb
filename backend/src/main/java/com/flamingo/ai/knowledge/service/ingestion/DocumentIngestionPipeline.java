package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.api.dto.request.IngestionRequest;
import com.flamingo.ai.knowledge.api.dto.request.PageContent;
import com.flamingo.ai.knowledge.domain.enums.IssueCode;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.model.IngestionIssue;
import com.flamingo.ai.knowledge.domain.source.DocumentSource;
import com.flamingo.ai.knowledge.exception.ChunkStoreException;
import com.flamingo.ai.knowledge.exception.OwnerIsolationViolationException;
import com.flamingo.ai.knowledge.service.ingestion.IngestionJobTracker.JobHandle;
import com.flamingo.ai.knowledge.service.rag.chunking.BoundaryChunker;
import com.flamingo.ai.knowledge.service.rag.chunking.TextChunk;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingResult;
import com.flamingo.ai.knowledge.service.rag.normalize.NormalizationResult;
import com.flamingo.ai.knowledge.service.rag.normalize.TextNormalizer;
import com.flamingo.ai.knowledge.store.Chunk;
import com.flamingo.ai.knowledge.store.ChunkStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns one document into stored chunks: normalize and chunk each page in parallel, embed every
 * chunk in one batched call, then upsert.
 *
 * <p>Non-fatal problems are collected as issues instead of thrown. Cancellation is honoured before
 * each page and once more before the write, so a cancelled job never leaves a partial write.
 */
@Service
@Slf4j
public class DocumentIngestionPipeline {

  private final TextNormalizer textNormalizer;
  private final BoundaryChunker boundaryChunker;
  private final EmbeddingGenerator embeddingGenerator;
  private final ChunkStore chunkStore;
  private final Executor pageExecutor;
  private final MeterRegistry meterRegistry;

  public DocumentIngestionPipeline(
      TextNormalizer textNormalizer,
      BoundaryChunker boundaryChunker,
      EmbeddingGenerator embeddingGenerator,
      ChunkStore chunkStore,
      @Qualifier("pageProcessingExecutor") Executor pageExecutor,
      MeterRegistry meterRegistry) {
    this.textNormalizer = textNormalizer;
    this.boundaryChunker = boundaryChunker;
    this.embeddingGenerator = embeddingGenerator;
    this.chunkStore = chunkStore;
    this.pageExecutor = pageExecutor;
    this.meterRegistry = meterRegistry;
  }

  /** Result of normalizing and chunking a single page. */
  private record PageOutcome(
      int position,
      Integer pageNumber,
      List<TextChunk> chunks,
      List<IngestionIssue> issues,
      boolean failed,
      boolean skipped) {}

  /**
   * Ingests a document for an owner.
   *
   * @param ownerId owner the chunks are stored under
   * @param request validated ingestion request
   * @param handle cancellation flag and progress counters
   * @return summary with status COMPLETED, FAILED or CANCELLED
   */
  @Timed(value = "document.ingest", description = "Time to ingest a document")
  public IngestionSummary ingest(String ownerId, IngestionRequest request, JobHandle handle) {
    String documentId = request.getDocumentId();
    List<PageContent> pages = request.getPages();
    log.info("Ingesting document {} for owner {} ({} pages)", documentId, ownerId, pages.size());

    Set<String> runningLines =
        textNormalizer.detectRunningLines(pages.stream().map(PageContent::getText).toList());

    List<CompletableFuture<PageOutcome>> futures = new ArrayList<>(pages.size());
    for (int i = 0; i < pages.size(); i++) {
      final int position = i;
      futures.add(
          CompletableFuture.supplyAsync(
              () -> processPage(position, pages.get(position), runningLines, handle),
              pageExecutor));
    }
    List<PageOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

    List<IngestionIssue> issues = new ArrayList<>();
    int failedPages = 0;
    for (PageOutcome outcome : outcomes) {
      issues.addAll(outcome.issues());
      if (outcome.failed()) {
        failedPages++;
      }
    }
    int processedPages = (int) outcomes.stream().filter(o -> !o.failed() && !o.skipped()).count();
    IngestionSummary.IngestionSummaryBuilder summary =
        IngestionSummary.builder()
            .documentId(documentId)
            .totalPages(pages.size())
            .processedPages(processedPages)
            .failedPages(failedPages)
            .issues(issues);

    if (handle.isCancelled()) {
      log.info("Ingestion of document {} cancelled after {} pages", documentId, processedPages);
      return summary.status(JobStatus.CANCELLED).build();
    }

    List<Chunk> chunks = assembleChunks(ownerId, request, outcomes);
    if (chunks.isEmpty()) {
      String reason =
          failedPages == pages.size()
              ? "All " + failedPages + " pages failed to process"
              : "Document produced no content after normalization";
      log.warn("Ingestion of document {} failed: {}", documentId, reason);
      meterRegistry.counter("document.processing.failure").increment();
      return summary.status(JobStatus.FAILED).retryable(false).errorMessage(reason).build();
    }

    int degraded = attachEmbeddings(chunks, issues);

    if (handle.isCancelled()) {
      log.info("Ingestion of document {} cancelled before write", documentId);
      return summary.status(JobStatus.CANCELLED).issues(issues).build();
    }

    int pruned;
    try {
      chunkStore.upsert(ownerId, chunks);
      pruned = failedPages == 0 ? prune(ownerId, documentId, chunks) : 0;
    } catch (ChunkStoreException e) {
      log.error("Store failure while ingesting document {}: {}", documentId, e.getMessage());
      meterRegistry.counter("document.processing.failure").increment();
      return summary
          .status(JobStatus.FAILED)
          .retryable(true)
          .errorMessage(e.getUserMessage())
          .issues(issues)
          .build();
    } catch (OwnerIsolationViolationException e) {
      log.error("Owner isolation violation while ingesting document {}", documentId, e);
      meterRegistry.counter("document.processing.failure").increment();
      return summary
          .status(JobStatus.FAILED)
          .retryable(false)
          .errorMessage("Internal error while storing chunks")
          .issues(issues)
          .build();
    }

    meterRegistry.counter("document.processing.success").increment();
    log.info(
        "Ingested document {}: {} chunks ({} degraded, {} pruned), {}/{} pages",
        documentId,
        chunks.size(),
        degraded,
        pruned,
        processedPages,
        pages.size());
    return summary
        .status(JobStatus.COMPLETED)
        .chunksStored(chunks.size())
        .degradedChunks(degraded)
        .chunksPruned(pruned)
        .issues(issues)
        .build();
  }

  /**
   * Name-based id of the {@code ordinal}-th chunk cut from the page at {@code pagePosition}. Stable
   * across re-ingestion because chunking is deterministic, and independent of whether other pages
   * of the same document succeeded.
   */
  public static String chunkId(String ownerId, String documentId, int pagePosition, int ordinal) {
    String name = ownerId + ":" + documentId + ":" + pagePosition + ":" + ordinal;
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
  }

  private PageOutcome processPage(
      int position, PageContent page, Set<String> runningLines, JobHandle handle) {
    Integer pageNumber = page.getPageNumber();
    if (handle.isCancelled()) {
      return new PageOutcome(position, pageNumber, List.of(), List.of(), false, true);
    }
    try {
      List<IngestionIssue> issues = new ArrayList<>();
      NormalizationResult normalized = textNormalizer.normalize(page.getText(), runningLines);
      if (normalized.degraded()) {
        log.warn(
            "NormalizationDegraded on page {}: {}", describe(position, page), normalized.reason());
        issues.add(
            IngestionIssue.forPage(
                IssueCode.NORMALIZATION_DEGRADED, pageNumber, normalized.reason()));
      }
      List<TextChunk> chunks = boundaryChunker.chunk(normalized.text());
      handle.pageProcessed();
      return new PageOutcome(position, pageNumber, chunks, issues, false, false);
    } catch (RuntimeException e) {
      log.warn("Page {} failed: {}", describe(position, page), e.toString());
      handle.pageFailed();
      IngestionIssue issue =
          IngestionIssue.forPage(IssueCode.PAGE_FAILED, pageNumber, e.getMessage());
      return new PageOutcome(position, pageNumber, List.of(), List.of(issue), true, false);
    }
  }

  /** Numbers chunks across pages and carries section titles over page breaks. */
  private List<Chunk> assembleChunks(
      String ownerId, IngestionRequest request, List<PageOutcome> outcomes) {
    DocumentSource source = request.getSource();
    List<Chunk> chunks = new ArrayList<>();
    String carriedSection = "";
    int index = 0;
    for (PageOutcome outcome : outcomes) {
      int ordinal = 0;
      for (TextChunk textChunk : outcome.chunks()) {
        String section =
            textChunk.sectionTitle().isEmpty() ? carriedSection : textChunk.sectionTitle();
        carriedSection = section;
        chunks.add(
            Chunk.builder()
                .chunkId(chunkId(ownerId, request.getDocumentId(), outcome.position(), ordinal))
                .ownerId(ownerId)
                .documentId(request.getDocumentId())
                .text(textChunk.text())
                .sourceType(source.type())
                .sourceLink(source.linkFor(outcome.pageNumber()))
                .sourceTitle(source.title())
                .pageNumber(outcome.pageNumber())
                .sectionTitle(section)
                .chunkIndex(index)
                .chunkSize(textChunk.size())
                .build());
        ordinal++;
        index++;
      }
    }
    return chunks;
  }

  /** Embeds all chunks in one call; returns how many got a fallback vector. */
  private int attachEmbeddings(List<Chunk> chunks, List<IngestionIssue> issues) {
    List<EmbeddingResult> results =
        embeddingGenerator.embed(chunks.stream().map(Chunk::getText).toList());
    int degraded = 0;
    for (int i = 0; i < chunks.size(); i++) {
      Chunk chunk = chunks.get(i);
      EmbeddingResult result = results.get(i);
      chunk.setEmbedding(result.vector());
      chunk.setDegraded(result.isDegraded());
      if (result.isDegraded()) {
        degraded++;
        issues.add(
            IngestionIssue.forChunk(
                IssueCode.EMBEDDING_BACKEND_UNAVAILABLE,
                chunk.getPageNumber(),
                chunk.getChunkId(),
                result.reason()));
      }
    }
    return degraded;
  }

  private int prune(String ownerId, String documentId, List<Chunk> kept) {
    Set<String> keep = new HashSet<>();
    kept.forEach(chunk -> keep.add(chunk.getChunkId()));
    int pruned = chunkStore.pruneDocument(ownerId, documentId, keep);
    if (pruned > 0) {
      log.info("Pruned {} stale chunks of document {}", pruned, documentId);
    }
    return pruned;
  }

  private static String describe(int position, PageContent page) {
    return page.getPageNumber() != null
        ? String.valueOf(page.getPageNumber())
        : "#" + (position + 1);
  }
}
