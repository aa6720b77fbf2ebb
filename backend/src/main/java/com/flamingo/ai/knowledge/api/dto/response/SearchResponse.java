package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.service.rag.retrieval.KnowledgeSearchService;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search: the first sources expanded, the rest on demand. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;
  private List<SourceResponse> primary;
  private List<SourceResponse> additional;
  private int totalSources;

  public static SearchResponse fromResult(KnowledgeSearchService.SearchResult result) {
    return SearchResponse.builder()
        .query(result.query())
        .primary(result.sources().primary().stream().map(SourceResponse::fromGroup).toList())
        .additional(result.sources().additional().stream().map(SourceResponse::fromGroup).toList())
        .totalSources(result.sources().totalSources())
        .build();
  }
}
