package com.flamingo.ai.knowledge.domain.source;

import com.flamingo.ai.knowledge.domain.enums.SourceType;

/** Text submitted directly. Has no link; results group by document. */
public record PlainTextSource(String title) implements DocumentSource {

  @Override
  public SourceType type() {
    return SourceType.PLAIN_TEXT;
  }

  @Override
  public String linkFor(Integer pageNumber) {
    return null;
  }
}
