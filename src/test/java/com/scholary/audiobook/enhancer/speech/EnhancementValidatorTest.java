package com.scholary.audiobook.enhancer.speech;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EnhancementValidatorTest {

  private final EnhancementValidator validator = new EnhancementValidator(300, 50);

  @Test
  void validate_shouldAcceptCleanContent() {
    ValidationReport report =
        validator.validate(
            "This is a perfectly ordinary sentence. And here is another one for good measure.");

    assertThat(report.valid()).isTrue();
    assertThat(report.issues()).isEmpty();
  }

  @Test
  void validate_shouldReportUnconvertedMathAndShortContent() {
    ValidationReport report = validator.validate("Short $x$ and $$y$$");

    assertThat(report.valid()).isFalse();
    assertThat(report.issues())
        .contains(
            "Unprocessed inline math expressions found",
            "Unprocessed block math expressions found",
            "Enhanced content is very short");
  }

  @Test
  void validate_shouldReportUnbalancedMarkers() {
    ValidationReport report =
        validator.validate(
            "[EMPHASIS] word and [SLIGHT_EMPHASIS] more text to reach the minimum length.");

    assertThat(report.issues())
        .containsExactly("Unbalanced emphasis markers", "Unbalanced slight emphasis markers");
  }

  @Test
  void validate_shouldCountLongSentences() {
    EnhancementValidator strict = new EnhancementValidator(10, 1);

    ValidationReport report = strict.validate("A sentence that is long. Short.");

    assertThat(report.issues())
        .containsExactly("Found 1 very long sentences that may be hard to narrate");
  }
}
