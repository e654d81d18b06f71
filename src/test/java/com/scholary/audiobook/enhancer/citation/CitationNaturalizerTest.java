package com.scholary.audiobook.enhancer.citation;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.audiobook.enhancer.document.Citation;
import com.scholary.audiobook.enhancer.document.CitationExtractor;
import org.junit.jupiter.api.Test;

class CitationNaturalizerTest {

  private final CitationNaturalizer naturalizer = new CitationNaturalizer();
  private final CitationExtractor extractor = new CitationExtractor();

  @Test
  void speak_shouldKeepCommaOnlyForCommaStyle() {
    assertThat(naturalizer.speak(new Citation("(Smith, 1964)", "Smith", "1964")))
        .isEqualTo("Smith, nineteen sixty-four");
    assertThat(naturalizer.speak(new Citation("[Jones 2001]", "Jones", "2001")))
        .isEqualTo("Jones twenty one");
  }

  @Test
  void naturalize_shouldReplaceEveryOccurrence() {
    String text = "As (Smith, 1964) showed, and (Smith, 1964) repeated.";

    String result = naturalizer.naturalize(text, extractor.extract(text));

    assertThat(result)
        .isEqualTo(
            "As Smith, nineteen sixty-four showed, and Smith, nineteen sixty-four repeated.");
  }
}
