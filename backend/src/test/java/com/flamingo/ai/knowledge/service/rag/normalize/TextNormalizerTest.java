package com.flamingo.ai.knowledge.service.rag.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TextNormalizer Tests")
class TextNormalizerTest {

  private TextNormalizer normalizer;

  @BeforeEach
  void setUp() {
    normalizer = new TextNormalizer();
  }

  @Nested
  @DisplayName("line rules")
  class LineRules {

    @Test
    @DisplayName("should remove isolated page numbers and page-of markers")
    void shouldRemovePageNumbers() {
      String raw = "First paragraph text.\n12\n- 13 -\nPage 4 of 20\nSecond paragraph text.";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.degraded()).isFalse();
      assertThat(result.text()).isEqualTo("First paragraph text.\nSecond paragraph text.");
      assertThat(result.removedLines()).isEqualTo(3);
    }

    @Test
    @DisplayName("should remove roman page numbers but keep words spelled with the same letters")
    void shouldRemoveOnlyWellFormedRomanNumerals() {
      String raw = "Preface text.\nxiv\ncivil\ncivic\nill\nvi\nMore text.";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.text()).isEqualTo("Preface text.\ncivil\ncivic\nill\nMore text.");
      assertThat(result.removedLines()).isEqualTo(2);
    }

    @Test
    @DisplayName("should remove bare chapter labels and figure captions")
    void shouldRemoveLabelsAndCaptions() {
      String raw = "CHAPTER 3\nThe model converges.\nFigure 2: Loss over epochs\nTable 1. Results";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.text()).isEqualTo("The model converges.");
    }

    @Test
    @DisplayName("should strip bracketed and author-year citations inline")
    void shouldStripCitations() {
      String raw = "Transformers dominate NLP [1, 2] and vision (Dosovitskiy et al., 2021).";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.text()).isEqualTo("Transformers dominate NLP and vision.");
    }

    @Test
    @DisplayName("should remove legal boilerplate lines")
    void shouldRemoveLegalLines() {
      String raw = "Quarterly numbers improved.\n© 2024 Acme Corp. All rights reserved.";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.text()).isEqualTo("Quarterly numbers improved.");
    }

    @Test
    @DisplayName("should remove numbered bibliography entries and trailing references heading")
    void shouldRemoveBibliography() {
      String raw =
          "Conclusion text.\n\nReferences\n[1] Smith, J. Deep learning. 2020.\n[2] Doe, A. 2019.";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.text()).isEqualTo("Conclusion text.");
    }

    @Test
    @DisplayName("should collapse whitespace runs but keep paragraph breaks")
    void shouldCollapseWhitespace() {
      String raw = "Alpha   beta\t\tgamma\n\n\n\n\nDelta";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.text()).isEqualTo("Alpha beta gamma\n\nDelta");
    }
  }

  @Nested
  @DisplayName("protected content")
  class ProtectedContent {

    @Test
    @DisplayName("should keep markdown and numbered headings")
    void shouldKeepHeadings() {
      String raw = "# Methods\n2.1 Data Collection\nWe sampled users.";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.text()).isEqualTo("# Methods\n2.1 Data Collection\nWe sampled users.");
    }

    @Test
    @DisplayName("should keep a substantive line even if it starts like a caption")
    void shouldKeepSubstantiveLine() {
      String line =
          "Figure 3: the treatment group improved markedly over the baseline. "
              + "The control group, by contrast, stayed flat across all twelve weeks of the "
              + "study. This difference held after adjusting for age.";

      NormalizationResult result = normalizer.normalize(line);

      assertThat(result.text()).isEqualTo(line);
    }
  }

  @Nested
  @DisplayName("running headers")
  class RunningHeaders {

    @Test
    @DisplayName("should detect lines repeated on most pages, ignoring page digits")
    void shouldDetectRunningLines() {
      List<String> pages =
          List.of(
              "Acme Annual Report - 1\nIntro text.",
              "Acme Annual Report - 2\nMore text.",
              "Acme Annual Report - 3\nEven more text.",
              "Acme Annual Report - 4\nClosing text.");

      Set<String> running = normalizer.detectRunningLines(pages);
      NormalizationResult result = normalizer.normalize(pages.get(2), running);

      assertThat(running).containsExactly("acme annual report - #");
      assertThat(result.text()).isEqualTo("Even more text.");
    }

    @Test
    @DisplayName("should not detect running lines in short documents")
    void shouldIgnoreShortDocuments() {
      assertThat(normalizer.detectRunningLines(List.of("Header\nA", "Header\nB"))).isEmpty();
    }
  }

  @Nested
  @DisplayName("degraded mode")
  class DegradedMode {

    @Test
    @DisplayName("should return original text when replacement characters dominate")
    void shouldReturnOriginalOnMisDecoding() {
      String raw = "Caf\uFFFD r\uFFFDsum\uFFFD\n12\nna\uFFFDve";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.degraded()).isTrue();
      assertThat(result.text()).isEqualTo(raw);
      assertThat(result.reason()).contains("mis-decoded");
    }

    @Test
    @DisplayName("should return original text when it contains NUL characters")
    void shouldReturnOriginalOnNul() {
      String raw = "binary\u0000garbage";

      NormalizationResult result = normalizer.normalize(raw);

      assertThat(result.degraded()).isTrue();
      assertThat(result.text()).isEqualTo(raw);
    }

    @Test
    @DisplayName("should return empty text for null or blank input")
    void shouldHandleBlankInput() {
      assertThat(normalizer.normalize(null).text()).isEmpty();
      assertThat(normalizer.normalize("   \n  ").text()).isEmpty();
    }
  }
}
