package com.scholary.audiobook.enhancer.service;

import com.scholary.audiobook.enhancer.annotation.AnnotationEngine;
import com.scholary.audiobook.enhancer.annotation.EnhancedText;
import com.scholary.audiobook.enhancer.document.DocumentTree;
import com.scholary.audiobook.enhancer.logging.StructuredLogger;
import com.scholary.audiobook.enhancer.segment.ChapterSegment;
import com.scholary.audiobook.enhancer.segment.ChapterSegmenter;
import com.scholary.audiobook.enhancer.speech.EnhancementValidator;
import com.scholary.audiobook.enhancer.speech.ValidationReport;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a document through annotation, validation and chapter segmentation.
 *
 * <p>Each run gets its own correlation id, set in MDC for the duration of the run so every log
 * line of the pipeline can be traced back to one document.
 */
@Service
public class EnhancementService {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnhancementService.class);

  private final AnnotationEngine annotationEngine;
  private final ChapterSegmenter chapterSegmenter;
  private final EnhancementValidator validator;

  public EnhancementService(
      AnnotationEngine annotationEngine,
      ChapterSegmenter chapterSegmenter,
      EnhancementValidator validator) {
    this.annotationEngine = annotationEngine;
    this.chapterSegmenter = chapterSegmenter;
    this.validator = validator;
  }

  /**
   * Enhance a document.
   *
   * @param tree the parsed document
   * @return the enhanced text, its validation report and its chapters
   * @throws com.scholary.audiobook.enhancer.annotation.AnnotationException if the tree is
   *     structurally invalid
   */
  public EnhancementResult enhance(DocumentTree tree) {
    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setDocumentContext(correlationId, tree.title());
    try {
      LOGGER.info(
          "Enhancing document: title={}, topLevelHeadings={}", tree.title(), tree.chapters().size());

      EnhancedText enhancedText = annotationEngine.annotate(tree);

      ValidationReport validation = validator.validate(enhancedText.content());
      if (!validation.valid()) {
        LOGGER.warn("Enhanced text has quality issues: {}", validation.issues());
      }

      List<ChapterSegment> chapters = chapterSegmenter.segment(enhancedText);
      return new EnhancementResult(correlationId, enhancedText, validation, chapters);
    } finally {
      StructuredLogger.clearDocumentContext();
    }
  }
}
