package com.flamingo.ai.knowledge.service.rag.chunking;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes single-line headings. Kinds are listed in boundary precedence order, highest first.
 */
public final class HeadingDetector {

  /** Heading kinds in precedence order. */
  public enum Kind {
    MARKDOWN,
    NUMBERED,
    ALL_CAPS
  }

  /** A detected heading: its kind and the title propagated to chunks below it. */
  public record Heading(Kind kind, String title) {}

  private static final Pattern MARKDOWN_HEADER = Pattern.compile("^#{1,6}\\s+(.+?)\\s*#*$");
  private static final Pattern NUMBERED_HEADER =
      Pattern.compile("^(\\d{1,3}(?:\\.\\d{1,3})*\\.?)\\s+(\\p{Lu}.*)$");
  private static final Pattern CAPS_HEADER =
      Pattern.compile("^[\\p{Lu}\\d][\\p{Lu}\\d\\s&:,'/()\\-]*$");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?;,:]$");

  private static final int MAX_HEADING_LENGTH = 100;
  private static final int MAX_NUMBERED_WORDS = 12;
  private static final int MIN_CAPS_LETTERS = 4;

  private HeadingDetector() {}

  public static Optional<Heading> detect(String line) {
    String trimmed = line.strip();
    if (trimmed.isEmpty() || trimmed.length() > MAX_HEADING_LENGTH) {
      return Optional.empty();
    }

    Matcher markdown = MARKDOWN_HEADER.matcher(trimmed);
    if (markdown.matches()) {
      return Optional.of(new Heading(Kind.MARKDOWN, markdown.group(1).strip()));
    }

    Matcher numbered = NUMBERED_HEADER.matcher(trimmed);
    if (numbered.matches()
        && !SENTENCE_END.matcher(trimmed).find()
        && trimmed.split("\\s+").length <= MAX_NUMBERED_WORDS + 1) {
      return Optional.of(new Heading(Kind.NUMBERED, trimmed));
    }

    if (CAPS_HEADER.matcher(trimmed).matches() && countLetters(trimmed) >= MIN_CAPS_LETTERS) {
      return Optional.of(new Heading(Kind.ALL_CAPS, trimmed));
    }
    return Optional.empty();
  }

  private static int countLetters(String text) {
    int letters = 0;
    for (int i = 0; i < text.length(); i++) {
      if (Character.isLetter(text.charAt(i))) {
        letters++;
      }
    }
    return letters;
  }
}
