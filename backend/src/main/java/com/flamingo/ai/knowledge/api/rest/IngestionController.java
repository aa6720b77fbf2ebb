package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.request.IngestionRequest;
import com.flamingo.ai.knowledge.api.dto.response.IngestionJobResponse;
import com.flamingo.ai.knowledge.domain.entity.IngestionJob;
import com.flamingo.ai.knowledge.service.ingestion.IngestionService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document ingestion jobs. */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class IngestionController {

  private final IngestionService ingestionService;

  /** Submits a document for asynchronous ingestion. */
  @PostMapping("/owners/{ownerId}/documents")
  public ResponseEntity<IngestionJobResponse> submitDocument(
      @PathVariable String ownerId, @Valid @RequestBody IngestionRequest request) {
    IngestionJob job = ingestionService.submit(ownerId, request);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestionJobResponse.fromEntity(job));
  }

  /** Lists an owner's ingestion jobs, newest first. */
  @GetMapping("/owners/{ownerId}/jobs")
  public ResponseEntity<List<IngestionJobResponse>> getJobsByOwner(@PathVariable String ownerId) {
    List<IngestionJobResponse> responses =
        ingestionService.getJobsByOwner(ownerId).stream()
            .map(IngestionJobResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets the status of an ingestion job. */
  @GetMapping("/jobs/{jobId}")
  public ResponseEntity<IngestionJobResponse> getJob(@PathVariable String jobId) {
    return ResponseEntity.ok(IngestionJobResponse.fromEntity(ingestionService.getJob(jobId)));
  }

  /** Cancels a queued or running ingestion job. */
  @PostMapping("/jobs/{jobId}/cancel")
  public ResponseEntity<IngestionJobResponse> cancelJob(@PathVariable String jobId) {
    return ResponseEntity.ok(IngestionJobResponse.fromEntity(ingestionService.cancel(jobId)));
  }

  /** Deletes every chunk of a document. */
  @DeleteMapping("/owners/{ownerId}/documents/{documentId}")
  public ResponseEntity<Void> deleteDocument(
      @PathVariable String ownerId, @PathVariable String documentId) {
    ingestionService.deleteDocument(ownerId, documentId);
    return ResponseEntity.noContent().build();
  }
}
