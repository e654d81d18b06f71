package com.scholary.audiobook.enhancer.segment;

import com.scholary.audiobook.enhancer.annotation.VoiceRole;
import com.scholary.audiobook.enhancer.annotation.VoiceSpan;
import com.scholary.audiobook.enhancer.speech.SpeechTextCleaner;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a chapter into voice segments: each voice span becomes one segment with its role and
 * pauses, and the text between spans is read by the narrator. Blank segments are dropped.
 */
public class VoiceSegmenter {

  private final SpeechTextCleaner cleaner;

  public VoiceSegmenter(SpeechTextCleaner cleaner) {
    this.cleaner = cleaner;
  }

  public List<VoiceSegment> split(ChapterSegment chapter) {
    String content = chapter.content();
    List<VoiceSpan> spans = new ArrayList<>(chapter.voiceSpans());
    spans.sort(Comparator.comparingInt(VoiceSpan::start));

    List<VoiceSegment> segments = new ArrayList<>();
    int cursor = 0;
    for (VoiceSpan span : spans) {
      if (span.start() < cursor || span.end() > content.length()) {
        continue;
      }
      addSegment(segments, content.substring(cursor, span.start()), VoiceRole.NARRATOR);
      addSegment(segments, content.substring(span.start(), span.end()), span.role());
      cursor = span.end();
    }
    addSegment(segments, content.substring(cursor), VoiceRole.NARRATOR);
    return segments;
  }

  private void addSegment(List<VoiceSegment> segments, String text, VoiceRole role) {
    if (text.isBlank()) {
      return;
    }
    segments.add(
        new VoiceSegment(
            text, cleaner.clean(text), role, role.getPauseBefore(), role.getPauseAfter()));
  }
}
