package com.scholary.audiobook.enhancer.api;

import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.annotation.PauseMarker;
import com.scholary.audiobook.enhancer.annotation.VoiceSpan;
import com.scholary.audiobook.enhancer.segment.ChapterSegment;
import com.scholary.audiobook.enhancer.service.EnhancementResult;
import java.util.List;
import java.util.Map;

/**
 * Response of an enhancement run.
 *
 * <p>Offsets index into {@code content}. When {@code offsetsExact} is false the text was
 * rewritten after they were recorded and they are approximate.
 */
public record EnhancementResponse(
    String correlationId,
    String content,
    boolean offsetsExact,
    List<VoiceSpan> voiceSpans,
    List<PauseMarker> pauseMarkers,
    List<Integer> chapterBreaks,
    List<String> chapterTitles,
    Map<String, String> pronunciationGuide,
    boolean valid,
    List<String> issues,
    List<ChapterSummary> chapters) {

  public record ChapterSummary(
      int index, String title, int startOffset, int endOffset, int voiceSpans, int pauses) {

    static ChapterSummary from(ChapterSegment chapter) {
      return new ChapterSummary(
          chapter.index(),
          chapter.title(),
          chapter.startOffset(),
          chapter.endOffset(),
          chapter.voiceSpans().size(),
          chapter.pauseMarkers().size());
    }
  }

  public static EnhancementResponse from(EnhancementResult result) {
    EnhancedText text = result.enhancedText();
    return new EnhancementResponse(
        result.correlationId(),
        text.content(),
        text.offsetsExact(),
        text.voiceSpans(),
        text.pauseMarkers(),
        text.chapterBreaks(),
        text.chapterTitles(),
        text.pronunciationGuide(),
        result.validation().valid(),
        result.validation().issues(),
        result.chapters().stream().map(ChapterSummary::from).toList());
  }
}
