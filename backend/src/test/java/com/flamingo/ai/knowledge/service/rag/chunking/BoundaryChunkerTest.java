package com.flamingo.ai.knowledge.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("BoundaryChunker Tests")
class BoundaryChunkerTest {

  private BoundaryChunker chunker;

  @BeforeEach
  void setUp() {
    KnowledgeConfig config = new KnowledgeConfig();
    config.getChunking().setMaxSize(2000);
    config.getChunking().setOverlap(200);
    chunker = new BoundaryChunker(config);
  }

  static String sentences(int targetLength) {
    StringBuilder text = new StringBuilder();
    int i = 0;
    while (text.length() < targetLength) {
      if (text.length() > 0) {
        text.append(' ');
      }
      text.append("Sentence ").append(i++).append(" reports the measured latency under load.");
    }
    return text.substring(0, targetLength);
  }

  @Nested
  @DisplayName("boundaries")
  class Boundaries {

    @Test
    @DisplayName("should produce zero chunks for empty input")
    void shouldReturnNoChunksForEmptyInput() {
      assertThat(chunker.chunk("")).isEmpty();
      assertThat(chunker.chunk("  \n\n ")).isEmpty();
      assertThat(chunker.chunk(null)).isEmpty();
    }

    @Test
    @DisplayName("should start a new chunk at every markdown heading")
    void shouldSplitAtMarkdownHeadings() {
      List<TextChunk> chunks = chunker.chunk("# Intro\nHello world.\n# Methods\nWe did things.");

      assertThat(chunks)
          .containsExactly(
              new TextChunk("# Intro\n\nHello world.", "Intro", 0),
              new TextChunk("# Methods\n\nWe did things.", "Methods", 1));
    }

    @Test
    @DisplayName("should treat numbered and ALL-CAPS lines as headings")
    void shouldDetectNumberedAndCapsHeadings() {
      List<TextChunk> numbered =
          chunker.chunk("1. Introduction\nIntro body.\n2. Results\nResult body.");
      List<TextChunk> caps =
          chunker.chunk("Preamble text.\n\nINTRODUCTION\nBody one.\n\nMETHODS\nBody two.");

      assertThat(numbered)
          .extracting(TextChunk::sectionTitle)
          .containsExactly("1. Introduction", "2. Results");
      assertThat(caps)
          .extracting(TextChunk::sectionTitle)
          .containsExactly("", "INTRODUCTION", "METHODS");
    }

    @Test
    @DisplayName("should merge consecutive headings into the chunk that follows them")
    void shouldMergeLoneHeadings() {
      List<TextChunk> chunks = chunker.chunk("# Guide\n## Setup\nInstall the tool.");

      assertThat(chunks)
          .containsExactly(new TextChunk("# Guide\n\n## Setup\n\nInstall the tool.", "Setup", 0));
    }

    @Test
    @DisplayName("should pack short paragraphs into one chunk")
    void shouldPackParagraphs() {
      List<TextChunk> chunks = chunker.chunk("First paragraph.\n\nSecond paragraph.");

      assertThat(chunks).hasSize(1);
      assertThat(chunks.get(0).text()).isEqualTo("First paragraph.\n\nSecond paragraph.");
      assertThat(chunks.get(0).sectionTitle()).isEmpty();
    }
  }

  @Nested
  @DisplayName("size and overlap")
  class SizeAndOverlap {

    @Test
    @DisplayName("should split a 2500-char section into two chunks sharing 200 chars")
    void shouldSplitLongSectionWithOverlap() {
      String text = "# Methods\n\n" + sentences(2500);

      List<TextChunk> chunks = chunker.chunk(text, 2000, 200);

      assertThat(chunks).hasSize(2);
      String first = chunks.get(0).text();
      String second = chunks.get(1).text();
      assertThat(second.substring(0, 200)).isEqualTo(first.substring(first.length() - 200));
      assertThat(chunks).allSatisfy(c -> assertThat(c.sectionTitle()).isEqualTo("Methods"));
      assertThat(chunks).allSatisfy(c -> assertThat(c.size()).isLessThanOrEqualTo(2000));
    }

    @Test
    @DisplayName("should cut an oversized paragraph at a sentence end")
    void shouldCutAtSentenceBoundary() {
      List<TextChunk> chunks = chunker.chunk(sentences(2500), 2000, 200);

      assertThat(chunks.get(0).text()).endsWith(".");
      assertThat(chunks.get(0).size()).isLessThanOrEqualTo(2000);
    }

    @Test
    @DisplayName("should cut at whitespace when no sentence ends, and hard-cut as last resort")
    void shouldFallBackToWhitespaceAndHardCut() {
      List<TextChunk> words = chunker.chunk("word ".repeat(20).strip(), 30, 10);
      List<TextChunk> letters = chunker.chunk("a".repeat(50), 20, 5);

      assertThat(words.get(0).text()).isEqualTo("word word word word word word");
      assertThat(letters).allSatisfy(c -> assertThat(c.size()).isLessThanOrEqualTo(20));
      assertThat(letters.get(0).text()).isEqualTo("a".repeat(20));
    }

    @Test
    @DisplayName("should clamp overlap to half of the maximum size")
    void shouldClampOverlap() {
      List<TextChunk> chunks = chunker.chunk("a".repeat(50), 20, 100);

      String first = chunks.get(0).text();
      assertThat(chunks.get(1).text()).startsWith(first.substring(first.length() - 10));
      assertThat(chunks).allSatisfy(c -> assertThat(c.size()).isLessThanOrEqualTo(20));
    }

    @Test
    @DisplayName("should reject non-positive size and negative overlap")
    void shouldRejectInvalidParameters() {
      assertThatThrownBy(() -> chunker.chunk("text", 0, 0))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> chunker.chunk("text", 10, -1))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "maxSize={0}, overlap={1}")
    @CsvSource({"150, 0", "150, 50", "500, 100", "2000, 200"})
    @DisplayName("should keep every chunk within the maximum size and be deterministic")
    void shouldRespectSizeBoundAndDeterminism(int maxSize, int overlap) {
      String text = randomDocument(new Random(42));

      List<TextChunk> first = chunker.chunk(text, maxSize, overlap);
      List<TextChunk> second = chunker.chunk(text, maxSize, overlap);

      assertThat(first).isNotEmpty();
      assertThat(first).allSatisfy(c -> assertThat(c.size()).isBetween(1, maxSize));
      assertThat(second).isEqualTo(first);
      assertThat(first)
          .extracting(TextChunk::chunkIndex)
          .containsExactlyElementsOf(indexes(first.size()));
    }
  }

  private static List<Integer> indexes(int count) {
    List<Integer> result = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      result.add(i);
    }
    return result;
  }

  private static String randomDocument(Random random) {
    String[] words = {"alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta"};
    List<String> parts = new ArrayList<>();
    for (int p = 0; p < 40; p++) {
      if (random.nextDouble() < 0.2) {
        parts.add("# Heading " + p);
        continue;
      }
      StringBuilder paragraph = new StringBuilder();
      int length = 1 + random.nextInt(400);
      for (int w = 0; w < length; w++) {
        if (w > 0) {
          paragraph.append(' ');
        }
        paragraph.append(words[random.nextInt(words.length)]);
        if (random.nextDouble() < 0.1) {
          paragraph.append('.');
        }
      }
      parts.add(paragraph.toString());
    }
    return String.join("\n\n", parts);
  }
}
