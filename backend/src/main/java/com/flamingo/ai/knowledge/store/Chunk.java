package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.domain.enums.SourceType;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The atomic retrievable unit: a piece of normalized document text with its embedding.
 *
 * <p>{@code chunkId} is the upsert key and is stable across re-ingestion of the same logical
 * chunk. Every chunk belongs to exactly one owner.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Chunk {

  private String chunkId;
  private String ownerId;
  private String documentId;
  private String text;
  private SourceType sourceType;

  /** Deep link to the origin (page URL, or file URL with a page fragment). */
  private String sourceLink;

  /** Display name of the origin (file name, page title). */
  private String sourceTitle;

  /** Set only when the origin is paginated. */
  private Integer pageNumber;

  @Builder.Default private String sectionTitle = "";

  private List<Float> embedding;

  /** Ordinal within the parent document, across pages. */
  private int chunkIndex;

  private int chunkSize;

  /** True when the embedding came from the hash fallback and needs re-embedding. */
  private boolean degraded;

  private Instant createdAt;
  private Instant updatedAt;
}
