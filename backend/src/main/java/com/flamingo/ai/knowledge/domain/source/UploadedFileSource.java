package com.flamingo.ai.knowledge.domain.source;

import com.flamingo.ai.knowledge.domain.enums.SourceType;
import jakarta.validation.constraints.NotBlank;

/** A file uploaded by the owner. Paginated files link to {@code fileUrl#page=N}. */
public record UploadedFileSource(@NotBlank String fileName, String fileUrl)
    implements DocumentSource {

  @Override
  public SourceType type() {
    return SourceType.UPLOADED_FILE;
  }

  @Override
  public String linkFor(Integer pageNumber) {
    if (fileUrl == null || fileUrl.isBlank()) {
      return null;
    }
    return pageNumber == null ? fileUrl : fileUrl + "#page=" + pageNumber;
  }

  @Override
  public String title() {
    return fileName;
  }
}
