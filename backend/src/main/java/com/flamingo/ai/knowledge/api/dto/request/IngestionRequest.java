package com.flamingo.ai.knowledge.api.dto.request;

import com.flamingo.ai.knowledge.domain.source.DocumentSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting one document, delivered as extracted pages. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionRequest {

  @NotBlank(message = "Document id is required")
  @Size(max = 255, message = "Document id must not exceed 255 characters")
  private String documentId;

  @NotNull(message = "Source is required")
  @Valid
  private DocumentSource source;

  @NotNull(message = "Pages are required")
  private List<@Valid PageContent> pages;

  public int totalCharacters() {
    if (pages == null) {
      return 0;
    }
    long total = 0;
    for (PageContent page : pages) {
      total += page.getText() == null ? 0 : page.getText().length();
    }
    return (int) Math.min(Integer.MAX_VALUE, total);
  }
}
