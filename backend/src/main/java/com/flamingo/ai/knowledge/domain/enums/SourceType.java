package com.flamingo.ai.knowledge.domain.enums;

/** Kind of origin a chunk was cut from. */
public enum SourceType {
  /** A file uploaded by the owner, possibly paginated (PDF, OCR output). */
  UPLOADED_FILE("uploaded-file"),

  /** A page synced from a connected workspace. */
  SYNCED_PAGE("synced-page"),

  /** Raw text submitted directly, without an addressable origin. */
  PLAIN_TEXT("plain-text");

  private final String wireName;

  SourceType(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }
}
