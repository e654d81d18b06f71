package com.scholary.audiobook.enhancer.annotation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The speech-ready buffer of a whole document and everything anchored to it.
 *
 * <p>{@code chapterBreaks} and {@code chapterTitles} are parallel lists; titles are the original,
 * untransformed headings. When {@code offsetsExact} is false the buffer was changed by a rewrite
 * after the offsets were recorded, and every offset is an approximation.
 */
public record EnhancedText(
    String content,
    List<VoiceSpan> voiceSpans,
    List<PauseMarker> pauseMarkers,
    List<Integer> chapterBreaks,
    List<String> chapterTitles,
    Map<String, String> pronunciationGuide,
    boolean offsetsExact) {

  public EnhancedText {
    voiceSpans = List.copyOf(voiceSpans);
    pauseMarkers = List.copyOf(pauseMarkers);
    chapterBreaks = List.copyOf(chapterBreaks);
    chapterTitles = List.copyOf(chapterTitles);
    pronunciationGuide = Collections.unmodifiableMap(new LinkedHashMap<>(pronunciationGuide));
    if (chapterBreaks.size() != chapterTitles.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Chapter breaks (%d) and titles (%d) must pair up",
              chapterBreaks.size(), chapterTitles.size()));
    }
  }

  public int length() {
    return content.length();
  }
}
