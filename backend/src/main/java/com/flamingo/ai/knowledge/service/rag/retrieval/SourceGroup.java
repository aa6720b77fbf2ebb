package com.flamingo.ai.knowledge.service.rag.retrieval;

import com.flamingo.ai.knowledge.domain.enums.SourceType;
import java.util.List;

/**
 * One or more hits that share a source, collapsed into a single displayed result.
 *
 * @param sourceKey identity the hits were grouped by
 * @param displayName human-readable source name
 * @param text up to the two best chunk texts, with a "+N more chunks" suffix when truncated
 * @param highlightedText {@code text} with query terms marked, or null when not requested
 * @param chunkCount number of hits in the group
 * @param score best score among the hits
 * @param url link to the source, may be null
 * @param summary where in the source the best hit was found, may be null
 * @param pageNumbers distinct page numbers of the hits, ascending
 * @param sourceType origin kind of the best hit
 * @param documentId document of the best hit
 */
public record SourceGroup(
    String sourceKey,
    String displayName,
    String text,
    String highlightedText,
    int chunkCount,
    double score,
    String url,
    String summary,
    List<Integer> pageNumbers,
    SourceType sourceType,
    String documentId) {

  public SourceGroup withHighlightedText(String highlighted) {
    return new SourceGroup(
        sourceKey,
        displayName,
        text,
        highlighted,
        chunkCount,
        score,
        url,
        summary,
        pageNumbers,
        sourceType,
        documentId);
  }
}
