package com.scholary.audiobook.enhancer.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class CitationExtractorTest {

  private final CitationExtractor extractor = new CitationExtractor();

  @Test
  void extract_shouldRecogniseAllThreeForms() {
    List<Citation> citations =
        extractor.extract("As shown (Smith, 1964), see [Jones 2001] and (Doe 1999).");

    assertThat(citations)
        .extracting(Citation::author, Citation::year)
        .containsExactly(
            tuple("Smith", "1964"),
            tuple("Jones", "2001"),
            tuple("Doe", "1999"));
    assertThat(citations.get(0).commaStyle()).isTrue();
    assertThat(citations.get(1).commaStyle()).isFalse();
  }

  @Test
  void extract_shouldDeduplicateRepeatedCitations() {
    List<Citation> citations = extractor.extract("(Smith, 1964) and again (Smith, 1964)");

    assertThat(citations).hasSize(1);
  }

  @Test
  void extract_shouldIgnoreNonFourDigitYears() {
    assertThat(extractor.extract("(Smith, 64) and (Page 12)")).isEmpty();
  }
}
