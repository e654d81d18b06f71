package com.scholary.audiobook.enhancer.pronunciation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class PronunciationApplierTest {

  private final PronunciationApplier applier =
      new PronunciationApplier(
          PronunciationDictionary.of(Map.of("ANOVA", "ah-NO-vah", "USD", "$ U S D")));

  @Test
  void applyToBody_shouldMatchWholeWordsIgnoringCase() {
    assertThat(applier.applyToBody("Run anova, not ANOVAs."))
        .isEqualTo("Run ah-NO-vah, not ANOVAs.");
  }

  @Test
  void applyToBody_shouldInsertReplacementLiterally() {
    assertThat(applier.applyToBody("Paid in USD")).isEqualTo("Paid in $ U S D");
  }

  @Test
  void applyToTitle_shouldMatchExactCasingOnly() {
    assertThat(applier.applyToTitle("Intro to ANOVA")).isEqualTo("Intro to ah-NO-vah");
    assertThat(applier.applyToTitle("intro to anova")).isEqualTo("intro to anova");
  }

  @Test
  void applyToBody_shouldLeaveTextUnchangedWithEmptyDictionary() {
    PronunciationApplier empty = new PronunciationApplier(PronunciationDictionary.empty());

    assertThat(empty.applyToBody("ANOVA")).isEqualTo("ANOVA");
    assertThat(empty.getDictionary().size()).isZero();
  }
}
