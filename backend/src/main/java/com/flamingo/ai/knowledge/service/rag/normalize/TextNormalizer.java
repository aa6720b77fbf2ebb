package com.flamingo.ai.knowledge.service.rag.normalize;

import com.flamingo.ai.knowledge.service.rag.chunking.HeadingDetector;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Removes extraction boilerplate from page text before chunking.
 *
 * <p>Rules operate line by line. Headings are never removed, and long multi-sentence lines are
 * protected from the caption and legal rules. Any failure returns the input unchanged with the
 * degraded flag set so ingestion can continue.
 */
@Slf4j
@Component
public class TextNormalizer {

  private static final char REPLACEMENT_CHAR = '\uFFFD';
  private static final double MAX_REPLACEMENT_RATIO = 0.01;

  private static final Pattern PAGE_NUMBER_LINE =
      Pattern.compile(
          "(?i)^(?:[-\\u2013\\u2014]\\s*)?(?:page\\s+)?\\d{1,4}(?:\\s*[-\\u2013\\u2014])?$");
  /** Well-formed lowercase roman numerals up to 399, as used for front matter pages. */
  private static final Pattern ROMAN_PAGE_LINE =
      Pattern.compile("^(?=[ivxlc])c{0,3}(?:xc|xl|l?x{0,3})(?:ix|iv|v?i{0,3})$");
  private static final Pattern PAGE_OF_LINE =
      Pattern.compile("(?i)^page\\s+\\d+\\s*(?:of|/)\\s*\\d+$");
  private static final Pattern BARE_LABEL_LINE =
      Pattern.compile("(?i)^(?:chapter|section|part|appendix)\\s+(?:\\d+|[ivxlcdm]+|[a-z])\\.?$");
  private static final Pattern CAPTION_LINE =
      Pattern.compile(
          "(?i)^(?:figure|fig\\.|table|chart|diagram|exhibit)\\s*\\d+(?:\\.\\d+)*"
              + "\\s*[.:)\\-\\u2013\\u2014].*$");
  private static final Pattern REFERENCE_ENTRY_LINE = Pattern.compile("^\\[\\d{1,4}]\\s+\\S.*$");
  private static final Pattern LEGAL_LINE_START =
      Pattern.compile(
          "(?i)^(?:\\u00A9|\\(c\\)\\s*\\d{4}|copyright\\b|all rights reserved|disclaimer\\s*:"
              + "|confidential\\b|proprietary and confidential|for internal use only"
              + "|no part of this (?:publication|document))");
  private static final Pattern LEGAL_ANYWHERE = Pattern.compile("(?i)all rights reserved");
  private static final int MAX_LEGAL_LINE_LENGTH = 300;

  private static final Pattern INLINE_PAGE_OF =
      Pattern.compile("(?i)\\bpage\\s+\\d+\\s+of\\s+\\d+\\b");
  private static final Pattern BRACKET_CITATION =
      Pattern.compile("\\s?\\[\\d{1,4}(?:\\s*[,\\u2013-]\\s*\\d{1,4})*]");
  private static final Pattern AUTHOR_YEAR_CITATION =
      Pattern.compile(
          "\\s?\\((?:see\\s+)?\\p{Lu}[\\p{L}'\\-]+"
              + "(?:\\s+(?:et al\\.|and|&)\\s*(?:\\p{Lu}[\\p{L}'\\-]+)?)?,?\\s+\\d{4}[a-z]?"
              + "(?:;\\s*\\p{Lu}[\\p{L}'\\-]+(?:\\s+et al\\.)?,?\\s+\\d{4}[a-z]?)*\\)");
  private static final Pattern HORIZONTAL_WHITESPACE =
      Pattern.compile("[ \\t\\u00A0\\u2000-\\u200B]+");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
  private static final Pattern TRAILING_REFERENCES_HEADING =
      Pattern.compile(
          "(?i)(?:^|\\n)\\s*(?:#{1,6}\\s*)?(?:references|bibliography|works cited)\\s*$");
  private static final Pattern SENTENCE_TERMINATOR = Pattern.compile("[.!?](?=\\s|$)");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private static final int SUBSTANTIVE_MIN_LENGTH = 160;
  private static final int SUBSTANTIVE_MIN_SENTENCES = 2;
  private static final int RUNNING_LINE_MIN_PAGES = 3;
  private static final int RUNNING_LINE_MAX_LENGTH = 120;

  public NormalizationResult normalize(String raw) {
    return normalize(raw, Set.of());
  }

  /**
   * Cleans one page of text.
   *
   * @param raw page text as extracted
   * @param runningLines digit-masked keys of header/footer lines repeated across the document, as
   *     returned by {@link #detectRunningLines(List)}
   */
  public NormalizationResult normalize(String raw, Set<String> runningLines) {
    if (raw == null || raw.isBlank()) {
      return NormalizationResult.cleaned("", 0);
    }
    String decodingProblem = detectMisDecoding(raw);
    if (decodingProblem != null) {
      log.warn("Skipping normalization: {}", decodingProblem);
      return NormalizationResult.degraded(raw, decodingProblem);
    }
    try {
      return clean(raw, runningLines);
    } catch (RuntimeException | StackOverflowError e) {
      log.warn("Normalization failed, keeping original text: {}", e.toString());
      return NormalizationResult.degraded(
          raw, "normalization failed: " + e.getClass().getSimpleName());
    }
  }

  /**
   * Finds lines repeated across pages, such as running headers and footers. A line qualifies when
   * it appears on at least three pages and on at least half of them. Digits are masked so footers
   * carrying page numbers match each other.
   */
  public Set<String> detectRunningLines(List<String> pages) {
    if (pages == null || pages.size() < RUNNING_LINE_MIN_PAGES) {
      return Set.of();
    }
    Map<String, Integer> pageCounts = new HashMap<>();
    for (String page : pages) {
      if (page == null) {
        continue;
      }
      Set<String> seenOnPage = new HashSet<>();
      for (String line : page.split("\\R")) {
        String trimmed = collapse(line).strip();
        if (trimmed.length() < 3
            || trimmed.length() > RUNNING_LINE_MAX_LENGTH
            || HeadingDetector.detect(trimmed)
                .filter(h -> h.kind() != HeadingDetector.Kind.ALL_CAPS)
                .isPresent()) {
          continue;
        }
        if (seenOnPage.add(runningKey(trimmed))) {
          pageCounts.merge(runningKey(trimmed), 1, Integer::sum);
        }
      }
    }
    int threshold = Math.max(RUNNING_LINE_MIN_PAGES, (pages.size() + 1) / 2);
    Set<String> running = new HashSet<>();
    pageCounts.forEach(
        (key, count) -> {
          if (count >= threshold) {
            running.add(key);
          }
        });
    return running;
  }

  static String runningKey(String line) {
    return DIGITS.matcher(line.strip().toLowerCase()).replaceAll("#");
  }

  private NormalizationResult clean(String raw, Set<String> runningLines) {
    String text = raw.replace("\r\n", "\n").replace('\r', '\n').replace('\f', '\n');
    List<String> kept = new ArrayList<>();
    int removed = 0;

    for (String original : text.split("\n", -1)) {
      String line = collapse(original).strip();
      if (line.isEmpty()) {
        kept.add("");
        continue;
      }
      if (HeadingDetector.detect(line)
          .filter(h -> h.kind() != HeadingDetector.Kind.ALL_CAPS)
          .isPresent()) {
        kept.add(line);
        continue;
      }
      if (isStructuralNoise(line, runningLines)) {
        removed++;
        continue;
      }
      boolean substantive = isSubstantive(line);
      if (!substantive && (CAPTION_LINE.matcher(line).matches() || isLegal(line))) {
        removed++;
        continue;
      }
      String stripped = stripInline(line);
      if (stripped.isEmpty()) {
        removed++;
        continue;
      }
      kept.add(stripped);
    }

    String joined = EXCESS_BLANK_LINES.matcher(String.join("\n", kept).strip()).replaceAll("\n\n");
    joined = TRAILING_REFERENCES_HEADING.matcher(joined).replaceFirst("").strip();
    return NormalizationResult.cleaned(joined, removed);
  }

  private boolean isStructuralNoise(String line, Set<String> runningLines) {
    return PAGE_NUMBER_LINE.matcher(line).matches()
        || ROMAN_PAGE_LINE.matcher(line).matches()
        || PAGE_OF_LINE.matcher(line).matches()
        || BARE_LABEL_LINE.matcher(line).matches()
        || REFERENCE_ENTRY_LINE.matcher(line).matches()
        || (!runningLines.isEmpty() && runningLines.contains(runningKey(line)));
  }

  private boolean isLegal(String line) {
    if (line.length() > MAX_LEGAL_LINE_LENGTH) {
      return false;
    }
    return LEGAL_LINE_START.matcher(line).find() || LEGAL_ANYWHERE.matcher(line).find();
  }

  private boolean isSubstantive(String line) {
    if (line.length() < SUBSTANTIVE_MIN_LENGTH) {
      return false;
    }
    long sentences = SENTENCE_TERMINATOR.matcher(line).results().count();
    return sentences >= SUBSTANTIVE_MIN_SENTENCES;
  }

  private String stripInline(String line) {
    String result = INLINE_PAGE_OF.matcher(line).replaceAll("");
    result = BRACKET_CITATION.matcher(result).replaceAll("");
    result = AUTHOR_YEAR_CITATION.matcher(result).replaceAll("");
    return collapse(result).strip();
  }

  private static String collapse(String line) {
    return HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ");
  }

  /** Returns a description of the decoding problem, or null when the text looks sane. */
  private static String detectMisDecoding(String text) {
    int replacements = 0;
    int controls = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == REPLACEMENT_CHAR) {
        replacements++;
      } else if (c == '\u0000') {
        return "text contains NUL characters";
      } else if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t' && c != '\f') {
        controls++;
      }
    }
    double ratio = (double) (replacements + controls) / text.length();
    if (ratio > MAX_REPLACEMENT_RATIO) {
      return String.format(
          "text looks mis-decoded (%d replacement, %d control characters)", replacements, controls);
    }
    return null;
  }
}
