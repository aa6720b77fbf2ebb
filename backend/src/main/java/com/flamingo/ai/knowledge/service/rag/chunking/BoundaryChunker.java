package com.flamingo.ai.knowledge.service.rag.chunking;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits normalized text into chunks along headings and paragraph breaks.
 *
 * <p>Every heading starts a new chunk once the current one holds body text. Paragraphs are packed
 * into the current chunk until the next one would exceed the size limit; the following chunk is
 * then seeded with the trailing {@code overlap} characters of the one just emitted. A paragraph
 * that cannot fit is split at the last sentence end within the remaining room, falling back to
 * whitespace and finally to a hard cut.
 *
 * <p>The output depends only on the input and the two size parameters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BoundaryChunker {

  static final String UNIT_SEPARATOR = "\n\n";

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?][\"')\\]]*(?=\\s)");

  private final KnowledgeConfig config;

  /** Chunks with the configured size and overlap. */
  public List<TextChunk> chunk(String text) {
    KnowledgeConfig.Chunking chunking = config.getChunking();
    return chunk(text, chunking.getMaxSize(), chunking.effectiveOverlap());
  }

  public List<TextChunk> chunk(String text, int maxSize, int overlap) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    if (overlap < 0) {
      throw new IllegalArgumentException("overlap must not be negative: " + overlap);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }
    int effectiveOverlap = Math.min(overlap, maxSize / 2);
    Builder builder = new Builder(maxSize, effectiveOverlap);

    List<String> paragraph = new ArrayList<>();
    for (String line : text.split("\\R")) {
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        builder.addParagraph(paragraph);
        paragraph.clear();
        continue;
      }
      Optional<HeadingDetector.Heading> heading = HeadingDetector.detect(trimmed);
      if (heading.isPresent()) {
        builder.addParagraph(paragraph);
        paragraph.clear();
        builder.addHeading(trimmed, heading.get().title());
      } else {
        paragraph.add(trimmed);
      }
    }
    builder.addParagraph(paragraph);

    List<TextChunk> chunks = builder.finish();
    log.debug(
        "Chunked {} chars into {} chunks (maxSize={}, overlap={})",
        text.length(),
        chunks.size(),
        maxSize,
        effectiveOverlap);
    return chunks;
  }

  /** Mutable packing state for a single {@code chunk} call. */
  private static final class Builder {

    private final int maxSize;
    private final int overlap;
    private final List<TextChunk> chunks = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();
    private boolean hasBody;
    private String sectionTitle = "";

    Builder(int maxSize, int overlap) {
      this.maxSize = maxSize;
      this.overlap = overlap;
    }

    void addHeading(String line, String title) {
      if (hasBody) {
        emit();
        current.setLength(0);
      }
      sectionTitle = title;
      append(line);
    }

    void addParagraph(List<String> lines) {
      if (lines.isEmpty()) {
        return;
      }
      String remaining = String.join("\n", lines);
      while (!remaining.isEmpty()) {
        int room = roomFor();
        if (remaining.length() <= room) {
          append(remaining);
          hasBody = true;
          return;
        }
        if (hasBody) {
          emitAndSeed();
          continue;
        }
        // Only headings or an overlap seed precede this paragraph, so it has to be split.
        int cut = findCut(remaining, Math.max(1, room));
        append(remaining.substring(0, cut).stripTrailing());
        hasBody = true;
        remaining = remaining.substring(cut).stripLeading();
        if (!remaining.isEmpty()) {
          emitAndSeed();
        }
      }
    }

    List<TextChunk> finish() {
      if (current.length() > 0) {
        emit();
      }
      return chunks;
    }

    private int roomFor() {
      return current.length() == 0 ? maxSize : maxSize - current.length() - UNIT_SEPARATOR.length();
    }

    private void append(String unit) {
      if (current.length() > 0) {
        current.append(UNIT_SEPARATOR);
      }
      current.append(unit);
    }

    private void emit() {
      chunks.add(new TextChunk(current.toString(), sectionTitle, chunks.size()));
      hasBody = false;
    }

    private void emitAndSeed() {
      String previous = current.toString();
      emit();
      current.setLength(0);
      if (overlap > 0) {
        current.append(previous, Math.max(0, previous.length() - overlap), previous.length());
      }
    }

    /** Index at which to cut {@code text} so the head fits into {@code room} characters. */
    private static int findCut(String text, int room) {
      int limit = Math.min(room, text.length());
      String window = text.substring(0, limit);
      int sentenceCut = -1;
      Matcher matcher = SENTENCE_END.matcher(text);
      while (matcher.find() && matcher.end() <= limit) {
        sentenceCut = matcher.end();
      }
      if (sentenceCut > 0) {
        return sentenceCut;
      }
      for (int i = window.length() - 1; i > 0; i--) {
        if (Character.isWhitespace(window.charAt(i))) {
          return i;
        }
      }
      return limit;
    }
  }
}
