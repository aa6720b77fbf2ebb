package com.flamingo.ai.knowledge.service.rag.retrieval;

import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.store.Chunk;
import com.flamingo.ai.knowledge.store.ScoredChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Collapses chunk-level hits into one result per source.
 *
 * <p>A hit's source identity is its {@code sourceLink}, else its {@code documentId}, else a
 * synthetic identity unique to that hit, so unidentifiable hits are never merged. Groups keep the
 * order in which their identity first appeared, which makes the final sort stable.
 */
@Slf4j
@Component
public class ResultConsolidator {

  static final String TEXT_SEPARATOR = " | ";
  static final int REPRESENTATIVE_CHUNKS = 2;

  private static final Comparator<SourceGroup> GROUP_ORDER =
      Comparator.comparingDouble(SourceGroup::score)
          .reversed()
          .thenComparing(Comparator.comparingInt(SourceGroup::chunkCount).reversed());

  /**
   * Groups hits by source and ranks the groups.
   *
   * @param hits ranked hits, best first
   * @return groups sorted by best score, then by number of contributing chunks, then by first
   *     appearance
   */
  public List<SourceGroup> consolidate(List<ScoredChunk> hits) {
    if (hits == null || hits.isEmpty()) {
      return List.of();
    }
    Map<String, List<ScoredChunk>> bySource = new LinkedHashMap<>();
    for (int i = 0; i < hits.size(); i++) {
      ScoredChunk hit = hits.get(i);
      bySource.computeIfAbsent(sourceIdentity(hit.chunk(), i), key -> new ArrayList<>()).add(hit);
    }

    List<SourceGroup> groups = new ArrayList<>(bySource.size());
    bySource.forEach((key, members) -> groups.add(toGroup(key, members)));
    // List.sort is stable, so equal groups keep first-appearance order.
    groups.sort(GROUP_ORDER);

    log.debug("Consolidated {} hits into {} source groups", hits.size(), groups.size());
    return groups;
  }

  /** Splits ranked groups into the first {@code primaryCount} and the rest. */
  public ConsolidatedSources present(List<SourceGroup> groups, int primaryCount) {
    if (groups.isEmpty()) {
      return ConsolidatedSources.empty();
    }
    int split = Math.max(0, Math.min(primaryCount, groups.size()));
    return new ConsolidatedSources(
        List.copyOf(groups.subList(0, split)), List.copyOf(groups.subList(split, groups.size())));
  }

  static String sourceIdentity(Chunk chunk, int position) {
    if (chunk.getSourceLink() != null && !chunk.getSourceLink().isBlank()) {
      return "link:" + chunk.getSourceLink();
    }
    if (chunk.getDocumentId() != null && !chunk.getDocumentId().isBlank()) {
      return "doc:" + chunk.getDocumentId();
    }
    String id = chunk.getChunkId() != null ? chunk.getChunkId() : Integer.toString(position);
    return "hit:" + position + ":" + id;
  }

  private SourceGroup toGroup(String key, List<ScoredChunk> members) {
    List<ScoredChunk> byScore = new ArrayList<>(members);
    byScore.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
    ScoredChunk best = byScore.get(0);
    Chunk bestChunk = best.chunk();

    List<Integer> pages =
        members.stream()
            .map(hit -> hit.chunk().getPageNumber())
            .filter(Objects::nonNull)
            .distinct()
            .sorted()
            .toList();

    return new SourceGroup(
        key,
        displayName(bestChunk),
        representativeText(byScore),
        null,
        members.size(),
        best.score(),
        bestChunk.getSourceLink(),
        summary(bestChunk),
        pages,
        bestChunk.getSourceType(),
        bestChunk.getDocumentId());
  }

  private String representativeText(List<ScoredChunk> byScore) {
    StringBuilder text = new StringBuilder();
    int shown = Math.min(REPRESENTATIVE_CHUNKS, byScore.size());
    for (int i = 0; i < shown; i++) {
      if (i > 0) {
        text.append(TEXT_SEPARATOR);
      }
      text.append(byScore.get(i).chunk().getText());
    }
    int hidden = byScore.size() - shown;
    if (hidden > 0) {
      text.append(" (+").append(hidden).append(" more chunks)");
    }
    return text.toString();
  }

  static String displayName(Chunk chunk) {
    if (chunk.getSourceTitle() != null && !chunk.getSourceTitle().isBlank()) {
      return chunk.getSourceTitle();
    }
    String documentId = chunk.getDocumentId();
    if (documentId == null || documentId.isBlank()) {
      return "Unknown source";
    }
    String shortId = documentId.length() > 8 ? documentId.substring(0, 8) + "..." : documentId;
    return chunk.getSourceType() == SourceType.SYNCED_PAGE
        ? "Synced page (" + shortId + ")"
        : "Document " + shortId;
  }

  static String summary(Chunk chunk) {
    String section = chunk.getSectionTitle();
    boolean hasSection = section != null && !section.isBlank();
    Integer page = chunk.getPageNumber();
    if (hasSection && page != null) {
      return "From " + section + " (Page " + page + ")";
    }
    if (hasSection) {
      return "From " + section;
    }
    return page != null ? "Page " + page : null;
  }
}
