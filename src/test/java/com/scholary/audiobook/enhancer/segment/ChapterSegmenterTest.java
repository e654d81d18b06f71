package com.scholary.audiobook.enhancer.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.annotation.PauseMarker;
import com.scholary.audiobook.enhancer.annotation.VoiceRole;
import com.scholary.audiobook.enhancer.annotation.VoiceSpan;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChapterSegmenterTest {

  private static final String CONTENT = "x".repeat(150);
  private static final List<Integer> BREAKS = List.of(0, 50, 120);
  private static final List<String> TITLES = List.of("One", "Two", "Three");

  private final ChapterSegmenter segmenter = new ChapterSegmenter("Chapter 1", false);

  @Test
  void segment_shouldRebaseSpansAndPausesIntoTheirChapter() {
    List<ChapterSegment> chapters =
        segmenter.segment(
            CONTENT,
            BREAKS,
            TITLES,
            List.of(new VoiceSpan(60, 80, VoiceRole.SECTION)),
            List.of(new PauseMarker(50, 1.5), new PauseMarker(150, 2.5)),
            true);

    assertThat(chapters).hasSize(3);
    ChapterSegment second = chapters.get(1);
    assertThat(second.index()).isEqualTo(1);
    assertThat(second.title()).isEqualTo("Two");
    assertThat(second.startOffset()).isEqualTo(50);
    assertThat(second.endOffset()).isEqualTo(120);
    assertThat(second.content()).hasSize(70);
    assertThat(second.voiceSpans()).containsExactly(new VoiceSpan(10, 30, VoiceRole.SECTION));
    assertThat(second.pauseMarkers()).containsExactly(new PauseMarker(0, 1.5));
    assertThat(chapters.get(0).voiceSpans()).isEmpty();
    assertThat(chapters.get(2).pauseMarkers()).containsExactly(new PauseMarker(30, 2.5));
  }

  @Test
  void segment_shouldCoverWholeBufferWithoutGaps() {
    List<ChapterSegment> chapters =
        segmenter.segment(CONTENT, BREAKS, TITLES, List.of(), List.of(), true);

    String joined =
        chapters.stream().map(ChapterSegment::content).reduce("", String::concat);
    assertThat(joined).isEqualTo(CONTENT);
  }

  @Test
  void segment_shouldDropStraddlingSpanByDefault() {
    List<ChapterSegment> chapters =
        segmenter.segment(
            CONTENT,
            BREAKS,
            TITLES,
            List.of(new VoiceSpan(40, 60, VoiceRole.CHAPTER)),
            List.of(),
            true);

    assertThat(chapters).allSatisfy(chapter -> assertThat(chapter.voiceSpans()).isEmpty());
  }

  @Test
  void segment_shouldRejectStraddlingSpanInStrictMode() {
    ChapterSegmenter strict = new ChapterSegmenter("Chapter 1", true);

    assertThatThrownBy(
            () ->
                strict.segment(
                    CONTENT,
                    BREAKS,
                    TITLES,
                    List.of(new VoiceSpan(40, 60, VoiceRole.CHAPTER)),
                    List.of(),
                    true))
        .isInstanceOf(SegmentationException.class)
        .hasMessageContaining("crosses chapter boundary at 50");
  }

  @Test
  void segment_shouldNotRejectStraddlingSpanWhenOffsetsAreApproximate() {
    ChapterSegmenter strict = new ChapterSegmenter("Chapter 1", true);

    List<ChapterSegment> chapters =
        strict.segment(
            CONTENT,
            BREAKS,
            TITLES,
            List.of(new VoiceSpan(40, 60, VoiceRole.CHAPTER)),
            List.of(),
            false);

    assertThat(chapters.get(0).voiceSpans()).isEmpty();
  }

  @Test
  void segment_shouldReturnSingleFallbackChapterWithoutBreaks() {
    List<ChapterSegment> chapters =
        segmenter.segment(
            "Just text.",
            List.of(),
            List.of(),
            List.of(new VoiceSpan(0, 4, VoiceRole.NARRATOR)),
            List.of(),
            true);

    assertThat(chapters).hasSize(1);
    assertThat(chapters.get(0).title()).isEqualTo("Chapter 1");
    assertThat(chapters.get(0).content()).isEqualTo("Just text.");
    assertThat(chapters.get(0).voiceSpans()).hasSize(1);
  }

  @Test
  void segment_shouldNumberChaptersWithoutTitles() {
    List<ChapterSegment> chapters =
        segmenter.segment(CONTENT, BREAKS, List.of("One"), List.of(), List.of(), true);

    assertThat(chapters).extracting(ChapterSegment::title)
        .containsExactly("One", "Chapter 2", "Chapter 3");
  }

  @Test
  void segment_shouldRejectDescendingBreaks() {
    assertThatThrownBy(
            () -> segmenter.segment(CONTENT, List.of(0, 80, 40), TITLES, List.of(), List.of(), true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ascending");
  }

  @Test
  void segment_shouldClampBreaksAfterRewriteShortenedBuffer() {
    EnhancedText rewritten =
        new EnhancedText(
            "short",
            List.of(new VoiceSpan(0, 3, VoiceRole.MAIN_TITLE)),
            List.of(),
            List.of(0, 100),
            List.of("A", "B"),
            Map.of(),
            false);

    List<ChapterSegment> chapters = segmenter.segment(rewritten);

    assertThat(chapters).hasSize(2);
    assertThat(chapters.get(0).content()).isEqualTo("short");
    assertThat(chapters.get(1).content()).isEmpty();
  }
}
