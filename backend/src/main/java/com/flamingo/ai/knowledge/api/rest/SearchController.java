package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.response.ChunkStatsResponse;
import com.flamingo.ai.knowledge.api.dto.response.SearchResponse;
import com.flamingo.ai.knowledge.service.ingestion.IngestionService;
import com.flamingo.ai.knowledge.service.rag.retrieval.KnowledgeSearchService;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for owner-scoped semantic search. */
@RestController
@RequestMapping
@RequiredArgsConstructor
@Validated
public class SearchController {

  private final KnowledgeSearchService knowledgeSearchService;
  private final IngestionService ingestionService;

  /** Searches an owner's documents and returns consolidated sources. */
  @GetMapping("/owners/{ownerId}/search")
  public ResponseEntity<SearchResponse> search(
      @PathVariable String ownerId,
      @RequestParam("q") @NotBlank @Size(max = 10000) String query,
      @RequestParam(required = false) @Positive Integer topK,
      @RequestParam(defaultValue = "false") boolean highlight) {
    return ResponseEntity.ok(
        SearchResponse.fromResult(
            knowledgeSearchService.search(ownerId, query, topK, highlight)));
  }

  /** Gets chunk statistics for an owner. */
  @GetMapping("/owners/{ownerId}/stats")
  public ResponseEntity<ChunkStatsResponse> getStats(@PathVariable String ownerId) {
    return ResponseEntity.ok(ChunkStatsResponse.fromStats(ingestionService.stats(ownerId)));
  }
}
