package com.scholary.audiobook.enhancer.speech;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SpeechTextCleanerTest {

  private final SpeechTextCleaner cleaner = new SpeechTextCleaner();

  @Test
  void clean_shouldStripMarkersAndTurnPausesIntoStops() {
    assertThat(cleaner.clean("[MATH] x [/MATH] is big [PAUSE] and [EMPHASIS] more [/EMPHASIS]."))
        .isEqualTo("x is big. and more.");
  }

  @Test
  void clean_shouldCollapseRepeatedStopsAndLeadingStop() {
    assertThat(cleaner.clean("[PAUSE] Start . . end.")).isEqualTo("Start. end.");
  }

  @Test
  void clean_shouldReturnEmptyForNull() {
    assertThat(cleaner.clean(null)).isEmpty();
  }
}
