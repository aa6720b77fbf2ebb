package com.flamingo.ai.knowledge.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persists chunks and serves owner-scoped similarity search.
 *
 * <p>Every operation takes the owner explicitly. Implementations enforce isolation themselves: a
 * read never returns, and a write never touches, a chunk of another owner.
 */
public interface ChunkStore {

  /**
   * Inserts or replaces chunks keyed by {@code chunkId}. A replaced chunk keeps its {@code
   * createdAt} and gets a new {@code updatedAt}. The whole batch is validated before anything is
   * written.
   *
   * @param ownerId owner every chunk must belong to
   * @param chunks chunks to write
   * @throws com.flamingo.ai.knowledge.exception.EmbeddingDimensionException if any embedding does
   *     not have the configured dimension
   * @throws com.flamingo.ai.knowledge.exception.OwnerIsolationViolationException if a chunk id is
   *     already owned by another owner
   * @throws com.flamingo.ai.knowledge.exception.ChunkStoreException if the storage is unreachable
   */
  void upsert(String ownerId, List<Chunk> chunks);

  /**
   * Ranks the owner's chunks by cosine similarity to the query vector, highest first; equal scores
   * put the more recently created chunk first.
   *
   * @param ownerId owner whose chunks are searched
   * @param queryVector vector of the configured dimension
   * @param topK maximum number of hits
   * @param extraFilter additional scalar filters
   * @return at most {@code topK} hits
   */
  List<ScoredChunk> search(
      String ownerId, List<Float> queryVector, int topK, ChunkFilter extraFilter);

  /**
   * Removes every chunk of one document.
   *
   * @return number of chunks removed
   */
  int deleteByDocument(String ownerId, String documentId);

  /**
   * Removes chunks of a document that are not in {@code keepChunkIds}. Used after a re-sync that
   * produced fewer chunks than the previous version.
   *
   * @return number of chunks removed
   */
  int pruneDocument(String ownerId, String documentId, Set<String> keepChunkIds);

  /**
   * Swaps in a new embedding for a degraded chunk and clears its degraded flag. Applies only while
   * the stored chunk is still degraded and still holds {@code expectedText}; a chunk rewritten
   * since it was read is left as it is.
   *
   * @param ownerId owner of the chunk
   * @param chunkId chunk to update
   * @param expectedText text the new embedding was computed from
   * @param embedding vector of the configured dimension
   * @return true if the chunk was updated
   */
  boolean replaceDegradedEmbedding(
      String ownerId, String chunkId, String expectedText, List<Float> embedding);

  /** Chunks whose embedding came from the fallback backend, oldest first, across owners. */
  List<Chunk> findDegraded(int limit);

  Optional<Chunk> findById(String ownerId, String chunkId);

  long count(String ownerId);

  ChunkStats stats(String ownerId);
}
