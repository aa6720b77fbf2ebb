package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.exception.EmbeddingDimensionException;
import com.flamingo.ai.knowledge.exception.OwnerIsolationViolationException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Validation and vector helpers shared by the chunk store backends. */
public final class ChunkStoreSupport {

  /** Score descending, then newer {@code createdAt} first. */
  public static final Comparator<ScoredChunk> RANKING =
      Comparator.comparingDouble(ScoredChunk::score)
          .reversed()
          .thenComparing(
              hit -> hit.chunk().getCreatedAt(),
              Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

  private ChunkStoreSupport() {}

  /**
   * Checks a whole batch before any of it is written.
   *
   * @throws OwnerIsolationViolationException if a chunk names a different owner
   * @throws EmbeddingDimensionException if an embedding has the wrong length
   * @throws IllegalArgumentException if a chunk has no id or no text
   */
  public static void validateBatch(String ownerId, List<Chunk> chunks, int dimension) {
    requireOwner(ownerId);
    for (Chunk chunk : chunks) {
      if (chunk.getChunkId() == null || chunk.getChunkId().isBlank()) {
        throw new IllegalArgumentException("Chunk id is required");
      }
      if (!ownerId.equals(chunk.getOwnerId())) {
        throw new OwnerIsolationViolationException(
            ownerId,
            chunk.getChunkId(),
            "Chunk " + chunk.getChunkId() + " belongs to owner " + chunk.getOwnerId()
                + ", not " + ownerId);
      }
      if (chunk.getText() == null || chunk.getText().isEmpty()) {
        throw new IllegalArgumentException("Chunk " + chunk.getChunkId() + " has empty text");
      }
      int actual = chunk.getEmbedding() == null ? 0 : chunk.getEmbedding().size();
      if (actual != dimension) {
        throw new EmbeddingDimensionException("chunk " + chunk.getChunkId(), dimension, actual);
      }
    }
  }

  public static void validateQueryVector(List<Float> queryVector, int dimension) {
    int actual = queryVector == null ? 0 : queryVector.size();
    if (actual != dimension) {
      throw new EmbeddingDimensionException("query vector", dimension, actual);
    }
  }

  public static void validateEmbedding(String chunkId, List<Float> embedding, int dimension) {
    int actual = embedding == null ? 0 : embedding.size();
    if (actual != dimension) {
      throw new EmbeddingDimensionException("chunk " + chunkId, dimension, actual);
    }
  }

  public static void requireOwner(String ownerId) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("ownerId is required");
    }
  }

  /** Last line of defence: a hit of another owner means a backend filter is broken. */
  public static void verifyOwnership(String ownerId, List<ScoredChunk> hits) {
    for (ScoredChunk hit : hits) {
      if (!ownerId.equals(hit.chunk().getOwnerId())) {
        throw new OwnerIsolationViolationException(
            ownerId,
            hit.chunk().getChunkId(),
            "Search for owner " + ownerId + " returned a chunk of " + hit.chunk().getOwnerId());
      }
    }
  }

  /** Cosine similarity; 0 when either vector has zero length. */
  public static double cosine(List<Float> a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < b.length; i++) {
      double x = a.get(i);
      double y = b[i];
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** Packs a vector as little-endian float32. */
  public static byte[] encode(List<Float> vector) {
    ByteBuffer buffer = ByteBuffer.allocate(vector.size() * Float.BYTES);
    buffer.order(ByteOrder.LITTLE_ENDIAN);
    for (Float value : vector) {
      buffer.putFloat(value);
    }
    return buffer.array();
  }

  public static float[] decode(byte[] bytes) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    float[] vector = new float[bytes.length / Float.BYTES];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = buffer.getFloat();
    }
    return vector;
  }

  public static List<Float> toList(float[] vector) {
    List<Float> list = new ArrayList<>(vector.length);
    for (float value : vector) {
      list.add(value);
    }
    return list;
  }
}
