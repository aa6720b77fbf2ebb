package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.store.ChunkStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an owner's chunk statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkStatsResponse {

  private String ownerId;
  private long totalChunks;
  private long documents;
  private long degradedChunks;
  private double avgChunkSize;
  private int minChunkSize;
  private int maxChunkSize;
  private long totalCharacters;

  public static ChunkStatsResponse fromStats(ChunkStats stats) {
    return ChunkStatsResponse.builder()
        .ownerId(stats.ownerId())
        .totalChunks(stats.totalChunks())
        .documents(stats.documents())
        .degradedChunks(stats.degradedChunks())
        .avgChunkSize(stats.avgChunkSize())
        .minChunkSize(stats.minChunkSize())
        .maxChunkSize(stats.maxChunkSize())
        .totalCharacters(stats.totalCharacters())
        .build();
  }
}
