package com.scholary.audiobook.enhancer.segment;

import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.annotation.PauseMarker;
import com.scholary.audiobook.enhancer.annotation.VoiceSpan;
import com.scholary.audiobook.enhancer.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts an {@link EnhancedText} into chapters at its chapter breaks.
 *
 * <p>Chapter {@code i} covers {@code [breaks[i], breaks[i+1])}, the last one runs to the end of
 * the buffer. A voice span belongs to the chapter its start falls in and is re-based by
 * subtracting the chapter start. Chapter text is the exact substring, not trimmed, so re-based
 * offsets index straight into it.
 *
 * <p>The engine always closes a title span before the next break, so a span crossing a boundary
 * means something upstream is wrong. Such a span is dropped and logged at ERROR, or rejected with
 * a {@link SegmentationException} in strict mode.
 */
public class ChapterSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChapterSegmenter.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final String fallbackTitle;
  private final boolean failOnStraddlingSpan;

  public ChapterSegmenter(String fallbackTitle, boolean failOnStraddlingSpan) {
    this.fallbackTitle = fallbackTitle;
    this.failOnStraddlingSpan = failOnStraddlingSpan;
  }

  public List<ChapterSegment> segment(EnhancedText text) {
    List<Integer> breaks = text.chapterBreaks();
    if (!text.offsetsExact()) {
      // a rewrite may have shortened the buffer
      breaks = clamp(breaks, text.length());
    }
    return segment(
        text.content(),
        breaks,
        text.chapterTitles(),
        text.voiceSpans(),
        text.pauseMarkers(),
        text.offsetsExact());
  }

  /**
   * Cut {@code content} at {@code breaks}.
   *
   * @param strict whether offsets are exact; only then can a straddling span raise
   */
  public List<ChapterSegment> segment(
      String content,
      List<Integer> breaks,
      List<String> titles,
      List<VoiceSpan> voiceSpans,
      List<PauseMarker> pauseMarkers,
      boolean strict) {

    int length = content.length();
    if (breaks.isEmpty()) {
      return List.of(
          new ChapterSegment(
              0,
              fallbackTitle,
              content,
              0,
              length,
              spansWithin(voiceSpans, 0, 0, length, strict),
              pausesWithin(pauseMarkers, 0, length, true)));
    }
    checkBreaks(breaks, length);

    List<ChapterSegment> chapters = new ArrayList<>(breaks.size());
    for (int i = 0; i < breaks.size(); i++) {
      int start = breaks.get(i);
      boolean last = i + 1 == breaks.size();
      int end = last ? length : breaks.get(i + 1);
      String title = i < titles.size() ? titles.get(i) : "Chapter " + (i + 1);

      chapters.add(
          new ChapterSegment(
              i,
              title,
              content.substring(start, end),
              start,
              end,
              spansWithin(voiceSpans, i, start, end, strict),
              pausesWithin(pauseMarkers, start, end, last)));
    }
    LOGGER.debug("Segmented buffer: length={}, chapters={}", length, chapters.size());
    return chapters;
  }

  private List<VoiceSpan> spansWithin(
      List<VoiceSpan> spans, int chapterIndex, int start, int end, boolean strict) {
    List<VoiceSpan> result = new ArrayList<>();
    for (VoiceSpan span : spans) {
      if (span.start() < start || span.start() >= end) {
        continue;
      }
      if (span.end() > end) {
        if (strict && failOnStraddlingSpan) {
          throw new SegmentationException(
              String.format(
                  "Voice span [%d-%d] crosses chapter boundary at %d",
                  span.start(), span.end(), end));
        }
        STRUCTURED_LOGGER.logSpanDropped(chapterIndex, span.start(), span.end(), end);
        continue;
      }
      result.add(span.shift(start));
    }
    return result;
  }

  private static List<PauseMarker> pausesWithin(
      List<PauseMarker> pauses, int start, int end, boolean last) {
    List<PauseMarker> result = new ArrayList<>();
    for (PauseMarker pause : pauses) {
      boolean inside = pause.offset() >= start && pause.offset() < end;
      boolean atEnd = last && pause.offset() == end;
      if (inside || atEnd) {
        result.add(pause.shift(start));
      }
    }
    return result;
  }

  private static void checkBreaks(List<Integer> breaks, int length) {
    int previous = -1;
    for (int offset : breaks) {
      if (offset < 0 || offset > length) {
        throw new IllegalArgumentException(
            String.format("Chapter break %d outside buffer of length %d", offset, length));
      }
      if (offset < previous) {
        throw new IllegalArgumentException("Chapter breaks must be ascending: " + breaks);
      }
      previous = offset;
    }
  }

  private static List<Integer> clamp(List<Integer> breaks, int length) {
    List<Integer> clamped = new ArrayList<>(breaks.size());
    for (int offset : breaks) {
      clamped.add(Math.max(0, Math.min(offset, length)));
    }
    return clamped;
  }
}
