package com.flamingo.ai.knowledge.service.rag.retrieval;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Marks literal, case-insensitive occurrences of query terms in result text. Does not affect
 * ranking.
 */
@Component
public class QueryHighlighter {

  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even");

  private static final int MIN_TOKEN_LENGTH = 2;

  /**
   * Wraps each match of a query token with {@code marker}. Longer tokens are tried first so a
   * token contained in another never splits its match.
   *
   * @return the highlighted text, or {@code text} unchanged when the query has no usable tokens
   */
  public String highlight(String text, String query, String marker) {
    if (text == null || text.isEmpty() || marker == null || marker.isEmpty()) {
      return text;
    }
    List<String> tokens = tokenize(query);
    if (tokens.isEmpty()) {
      return text;
    }
    String alternation = tokens.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    Pattern pattern =
        Pattern.compile("(" + alternation + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    String quotedMarker = Matcher.quoteReplacement(marker);
    return pattern.matcher(text).replaceAll(quotedMarker + "$1" + quotedMarker);
  }

  /** Distinct lower-case query tokens worth highlighting, longest first. */
  List<String> tokenize(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    return Arrays.stream(query.toLowerCase().split("[^\\p{L}\\p{N}']+"))
        .map(word -> word.replaceAll("^'+|'+$", ""))
        .filter(word -> word.length() >= MIN_TOKEN_LENGTH)
        .filter(word -> !STOP_WORDS.contains(word))
        .distinct()
        .sorted(Comparator.comparingInt(String::length).reversed())
        .toList();
  }
}
