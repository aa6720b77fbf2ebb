package com.flamingo.ai.knowledge.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One page of already-extracted document text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageContent {

  @NotNull(message = "Page text is required")
  private String text;

  /** Set only for paginated origins. */
  @Positive(message = "Page number must be positive")
  private Integer pageNumber;
}
