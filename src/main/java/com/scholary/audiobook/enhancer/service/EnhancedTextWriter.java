package com.scholary.audiobook.enhancer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.annotation.VoiceRole;
import com.scholary.audiobook.enhancer.segment.ChapterSegment;
import com.scholary.audiobook.enhancer.segment.VoiceSegment;
import com.scholary.audiobook.enhancer.segment.VoiceSegmenter;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Writes enhanced text in two formats.
 *
 * <p>JSON is the machine-readable export of the buffer and all its annotations. The chapter
 * script is a human-readable narration plan for review before synthesis.
 */
@Component
public class EnhancedTextWriter {

  private final ObjectMapper objectMapper;
  private final VoiceSegmenter voiceSegmenter;

  public EnhancedTextWriter(ObjectMapper objectMapper, VoiceSegmenter voiceSegmenter) {
    this.objectMapper = objectMapper;
    this.voiceSegmenter = voiceSegmenter;
  }

  public byte[] writeJson(EnhancedText enhancedText) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(enhancedText);
  }

  /**
   * Write the chapter script.
   *
   * <p>Format:
   *
   * <pre>
   * === Chapter 1: Introduction ===
   * [chapter_voice +2.0s/+1.5s] Introduction
   * [main_narrator] The spoken body text.
   * </pre>
   */
  public String writeScript(List<ChapterSegment> chapters) {
    StringBuilder script = new StringBuilder();
    for (ChapterSegment chapter : chapters) {
      script
          .append("=== Chapter ")
          .append(chapter.index() + 1)
          .append(": ")
          .append(chapter.title())
          .append(" ===\n");

      for (VoiceSegment segment : voiceSegmenter.split(chapter)) {
        script.append('[').append(segment.role().getKey());
        if (segment.role() != VoiceRole.NARRATOR) {
          script.append(
              String.format(
                  Locale.ROOT, " +%.1fs/+%.1fs", segment.pauseBefore(), segment.pauseAfter()));
        }
        script.append("] ").append(segment.spokenText()).append('\n');
      }
      script.append('\n');
    }
    return script.toString();
  }
}
