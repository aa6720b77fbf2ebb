package com.flamingo.ai.knowledge.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.knowledge.service.rag.retrieval.SourceGroup;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One consolidated search result. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceResponse {

  private String text;
  private String highlightedText;
  private SourceRef source;
  private double score;
  private int chunkCount;
  private String summary;
  private List<Integer> pageNumbers;

  /** Where the result came from. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SourceRef {
    private String displayName;
    private String url;
  }

  public static SourceResponse fromGroup(SourceGroup group) {
    return SourceResponse.builder()
        .text(group.text())
        .highlightedText(group.highlightedText())
        .source(SourceRef.builder().displayName(group.displayName()).url(group.url()).build())
        .score(group.score())
        .chunkCount(group.chunkCount())
        .summary(group.summary())
        .pageNumbers(group.pageNumbers().isEmpty() ? null : group.pageNumbers())
        .build();
  }
}
