package com.flamingo.ai.knowledge.domain.source;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flamingo.ai.knowledge.domain.enums.SourceType;

/**
 * Origin of an ingested document. Each variant carries only the fields that make sense for it.
 *
 * <p>Serialized with a {@code type} discriminator: {@code uploaded-file}, {@code synced-page} or
 * {@code plain-text}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = UploadedFileSource.class, name = "uploaded-file"),
  @JsonSubTypes.Type(value = SyncedPageSource.class, name = "synced-page"),
  @JsonSubTypes.Type(value = PlainTextSource.class, name = "plain-text")
})
public interface DocumentSource {

  SourceType type();

  /**
   * Deep link for content found on the given page.
   *
   * @param pageNumber page the chunk came from, or null when the origin is not paginated
   * @return the link, or null when the source has no addressable location
   */
  String linkFor(Integer pageNumber);

  /** Human readable name for the source, or null when none is known. */
  String title();
}
