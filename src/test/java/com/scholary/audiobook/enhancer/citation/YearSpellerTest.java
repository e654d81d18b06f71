package com.scholary.audiobook.enhancer.citation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class YearSpellerTest {

  @Test
  void speak_shouldReadTwentiethCenturyYears() {
    assertThat(YearSpeller.speak("1964")).isEqualTo("nineteen sixty-four");
    assertThat(YearSpeller.speak("1905")).isEqualTo("nineteen oh five");
    assertThat(YearSpeller.speak("1900")).isEqualTo("nineteen hundred");
    assertThat(YearSpeller.speak("1010")).isEqualTo("ten ten");
  }

  @Test
  void speak_shouldReadTwentyFirstCenturyYears() {
    assertThat(YearSpeller.speak("2000")).isEqualTo("twenty hundred");
    assertThat(YearSpeller.speak("2010")).isEqualTo("twenty ten");
    assertThat(YearSpeller.speak("2023")).isEqualTo("twenty twenty-three");
  }

  @Test
  void speak_shouldReturnOutOfRangeOrInvalidInputUnchanged() {
    assertThat(YearSpeller.speak("999")).isEqualTo("999");
    assertThat(YearSpeller.speak("2100")).isEqualTo("2100");
    assertThat(YearSpeller.speak("abcd")).isEqualTo("abcd");
  }

  @Test
  void belowHundred_shouldHyphenateCompounds() {
    assertThat(YearSpeller.belowHundred(13)).isEqualTo("thirteen");
    assertThat(YearSpeller.belowHundred(40)).isEqualTo("forty");
    assertThat(YearSpeller.belowHundred(99)).isEqualTo("ninety-nine");
  }
}
