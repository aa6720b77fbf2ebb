package com.flamingo.ai.knowledge.service.rag.chunking;

/**
 * One chunk cut by {@link BoundaryChunker}.
 *
 * @param text chunk content, never empty
 * @param sectionTitle most recent heading seen, or empty before the first heading
 * @param chunkIndex position within the chunked text, starting at 0
 */
public record TextChunk(String text, String sectionTitle, int chunkIndex) {

  public int size() {
    return text.length();
  }
}
