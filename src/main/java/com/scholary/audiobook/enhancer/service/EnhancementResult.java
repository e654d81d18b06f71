package com.scholary.audiobook.enhancer.service;

import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.segment.ChapterSegment;
import com.scholary.audiobook.enhancer.speech.ValidationReport;
import java.util.List;

/** Everything one enhancement run produces. */
public record EnhancementResult(
    String correlationId,
    EnhancedText enhancedText,
    ValidationReport validation,
    List<ChapterSegment> chapters) {

  public EnhancementResult {
    chapters = List.copyOf(chapters);
  }
}
