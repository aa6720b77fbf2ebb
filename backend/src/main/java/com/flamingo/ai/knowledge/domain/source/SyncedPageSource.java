package com.flamingo.ai.knowledge.domain.source;

import com.flamingo.ai.knowledge.domain.enums.SourceType;
import jakarta.validation.constraints.NotBlank;

/**
 * A page synced from a connected workspace. Without an explicit url the page id is turned into a
 * workspace link.
 */
public record SyncedPageSource(@NotBlank String pageId, String title, String url)
    implements DocumentSource {

  private static final String WORKSPACE_BASE_URL = "https://notion.so/";

  @Override
  public SourceType type() {
    return SourceType.SYNCED_PAGE;
  }

  @Override
  public String linkFor(Integer pageNumber) {
    if (url != null && !url.isBlank()) {
      return url;
    }
    return WORKSPACE_BASE_URL + pageId.replace("-", "");
  }
}
