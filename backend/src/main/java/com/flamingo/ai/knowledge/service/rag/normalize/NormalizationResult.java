package com.flamingo.ai.knowledge.service.rag.normalize;

/**
 * Output of {@link TextNormalizer}.
 *
 * @param text cleaned text, or the original text when {@code degraded}
 * @param degraded true when normalization was skipped and the input returned unchanged
 * @param reason why normalization was skipped; null otherwise
 * @param removedLines number of boilerplate lines dropped
 */
public record NormalizationResult(String text, boolean degraded, String reason, int removedLines) {

  public static NormalizationResult cleaned(String text, int removedLines) {
    return new NormalizationResult(text, false, null, removedLines);
  }

  public static NormalizationResult degraded(String original, String reason) {
    return new NormalizationResult(original, true, reason, 0);
  }
}
