package com.flamingo.ai.knowledge.store;

/** Size statistics over one owner's chunks. */
public record ChunkStats(
    String ownerId,
    long totalChunks,
    long documents,
    long degradedChunks,
    double avgChunkSize,
    int minChunkSize,
    int maxChunkSize,
    long totalCharacters) {

  public static ChunkStats empty(String ownerId) {
    return new ChunkStats(ownerId, 0, 0, 0, 0.0, 0, 0, 0);
  }
}
