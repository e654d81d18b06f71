package com.scholary.audiobook.enhancer.annotation;

import com.scholary.audiobook.enhancer.citation.CitationNaturalizer;
import com.scholary.audiobook.enhancer.document.CitationExtractor;
import com.scholary.audiobook.enhancer.math.MathSpanProcessor;
import com.scholary.audiobook.enhancer.pronunciation.PronunciationApplier;
import com.scholary.audiobook.enhancer.speech.SpeechOptimizer;
import com.scholary.audiobook.enhancer.wrap.AutoMathWrapper;

/**
 * The per-node body pipeline: wrap bare math, speak math, naturalize citations, apply
 * pronunciations, optimize for speech.
 *
 * <p>Math anchors and citations are re-derived from the text at the stage that consumes them,
 * since every earlier stage may have changed its length.
 */
public class ContentEnhancer {

  private final AutoMathWrapper wrapper;
  private final MathSpanProcessor mathProcessor;
  private final CitationExtractor citationExtractor;
  private final CitationNaturalizer citationNaturalizer;
  private final PronunciationApplier pronunciationApplier;
  private final SpeechOptimizer speechOptimizer;
  private final boolean mathEnabled;
  private final boolean citationsEnabled;

  public ContentEnhancer(
      AutoMathWrapper wrapper,
      MathSpanProcessor mathProcessor,
      CitationExtractor citationExtractor,
      CitationNaturalizer citationNaturalizer,
      PronunciationApplier pronunciationApplier,
      SpeechOptimizer speechOptimizer,
      boolean mathEnabled,
      boolean citationsEnabled) {
    this.wrapper = wrapper;
    this.mathProcessor = mathProcessor;
    this.citationExtractor = citationExtractor;
    this.citationNaturalizer = citationNaturalizer;
    this.pronunciationApplier = pronunciationApplier;
    this.speechOptimizer = speechOptimizer;
    this.mathEnabled = mathEnabled;
    this.citationsEnabled = citationsEnabled;
  }

  public String enhance(String body) {
    String text = wrapper.wrap(body);
    if (mathEnabled) {
      text = mathProcessor.process(text);
    }
    if (citationsEnabled) {
      text = citationNaturalizer.naturalize(text, citationExtractor.extract(text));
    }
    text = pronunciationApplier.applyToBody(text);
    return speechOptimizer.optimize(text);
  }
}
