package com.scholary.audiobook.enhancer.segment;

import com.scholary.audiobook.enhancer.annotation.PauseMarker;
import com.scholary.audiobook.enhancer.annotation.VoiceSpan;
import java.util.List;

/**
 * One chapter cut from the buffer. Spans and pauses are relative to {@code content}; {@code
 * startOffset} and {@code endOffset} locate the chapter in the whole buffer.
 */
public record ChapterSegment(
    int index,
    String title,
    String content,
    int startOffset,
    int endOffset,
    List<VoiceSpan> voiceSpans,
    List<PauseMarker> pauseMarkers) {

  public ChapterSegment {
    voiceSpans = List.copyOf(voiceSpans);
    pauseMarkers = List.copyOf(pauseMarkers);
  }
}
