package com.scholary.audiobook.enhancer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.scholary.audiobook.enhancer.annotation.AnnotationEngine;
import com.scholary.audiobook.enhancer.annotation.ContentEnhancer;
import com.scholary.audiobook.enhancer.cache.InMemorySpokenMathCache;
import com.scholary.audiobook.enhancer.cache.SpokenMathCache;
import com.scholary.audiobook.enhancer.citation.CitationNaturalizer;
import com.scholary.audiobook.enhancer.document.CitationExtractor;
import com.scholary.audiobook.enhancer.document.MathExpressionExtractor;
import com.scholary.audiobook.enhancer.math.MarkupParser;
import com.scholary.audiobook.enhancer.math.MathSpanProcessor;
import com.scholary.audiobook.enhancer.math.MathTransducer;
import com.scholary.audiobook.enhancer.math.PandocMarkupParser;
import com.scholary.audiobook.enhancer.math.RegexMathTransducer;
import com.scholary.audiobook.enhancer.math.StructureAwareMathTransducer;
import com.scholary.audiobook.enhancer.pronunciation.PronunciationApplier;
import com.scholary.audiobook.enhancer.pronunciation.PronunciationDictionary;
import com.scholary.audiobook.enhancer.rewrite.TextRewriter;
import com.scholary.audiobook.enhancer.rewrite.TextRewriters;
import com.scholary.audiobook.enhancer.segment.ChapterSegmenter;
import com.scholary.audiobook.enhancer.segment.VoiceSegmenter;
import com.scholary.audiobook.enhancer.speech.EnhancementValidator;
import com.scholary.audiobook.enhancer.speech.MarkdownSpeechCleaner;
import com.scholary.audiobook.enhancer.speech.SpeechOptimizer;
import com.scholary.audiobook.enhancer.speech.SpeechTextCleaner;
import com.scholary.audiobook.enhancer.wrap.AutoMathWrapper;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the enhancement pipeline from {@link EnhancementProperties}.
 *
 * <p>The math backend is chosen here, once: structure-aware when enabled and the markup parser
 * answers its probe, regex otherwise.
 */
@Configuration
@EnableConfigurationProperties(EnhancementProperties.class)
public class EnhancementConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(EnhancementConfig.class);

  @Bean
  public RegexMathTransducer regexMathTransducer() {
    return new RegexMathTransducer();
  }

  @Bean
  public MarkupParser markupParser(EnhancementProperties properties, ObjectMapper objectMapper) {
    EnhancementProperties.MathProperties math = properties.math();
    return new PandocMarkupParser(
        math.pandocCommand(), Duration.ofSeconds(math.pandocTimeoutSeconds()), objectMapper);
  }

  @Bean
  public MathTransducer mathTransducer(
      EnhancementProperties properties,
      MarkupParser markupParser,
      RegexMathTransducer regexMathTransducer) {
    MathTransducer transducer =
        properties.math().structureAware() && markupParser.isAvailable()
            ? new StructureAwareMathTransducer(markupParser, regexMathTransducer)
            : regexMathTransducer;
    LOGGER.info("Math backend selected: {}", transducer.getBackendName());
    return transducer;
  }

  @Bean
  public SpokenMathCache spokenMathCache(EnhancementProperties properties) {
    return new InMemorySpokenMathCache(properties.math().cacheMaxSize());
  }

  @Bean
  public MathSpanProcessor mathSpanProcessor(
      MathTransducer mathTransducer,
      RegexMathTransducer regexMathTransducer,
      SpokenMathCache spokenMathCache,
      MathExpressionExtractor mathExpressionExtractor) {
    return new MathSpanProcessor(
        mathTransducer, regexMathTransducer, spokenMathCache, mathExpressionExtractor);
  }

  @Bean
  public PronunciationDictionary pronunciationDictionary(EnhancementProperties properties) {
    return PronunciationDictionary.load(properties.pronunciation(), new YAMLMapper());
  }

  @Bean
  public PronunciationApplier pronunciationApplier(PronunciationDictionary dictionary) {
    return new PronunciationApplier(dictionary);
  }

  @Bean
  public SpeechOptimizer speechOptimizer(
      EnhancementProperties properties, MarkdownSpeechCleaner markdownSpeechCleaner) {
    return new SpeechOptimizer(
        markdownSpeechCleaner, properties.speech().longSentenceThreshold());
  }

  @Bean
  public ContentEnhancer contentEnhancer(
      EnhancementProperties properties,
      AutoMathWrapper autoMathWrapper,
      MathSpanProcessor mathSpanProcessor,
      CitationExtractor citationExtractor,
      CitationNaturalizer citationNaturalizer,
      PronunciationApplier pronunciationApplier,
      SpeechOptimizer speechOptimizer) {
    return new ContentEnhancer(
        autoMathWrapper,
        mathSpanProcessor,
        citationExtractor,
        citationNaturalizer,
        pronunciationApplier,
        speechOptimizer,
        properties.math().enabled(),
        properties.citations().enabled());
  }

  @Bean
  public TextRewriter textRewriter(EnhancementProperties properties, ObjectMapper objectMapper) {
    TextRewriter rewriter =
        TextRewriters.forMode(properties.processingMode(), properties.rewrite(), objectMapper);
    LOGGER.info(
        "Rewriter selected: mode={}, provider={}",
        properties.processingMode(),
        rewriter.getProviderName());
    return rewriter;
  }

  @Bean
  public AnnotationEngine annotationEngine(
      ContentEnhancer contentEnhancer,
      PronunciationApplier pronunciationApplier,
      TextRewriter textRewriter) {
    return new AnnotationEngine(contentEnhancer, pronunciationApplier, textRewriter);
  }

  @Bean
  public ChapterSegmenter chapterSegmenter(EnhancementProperties properties) {
    return new ChapterSegmenter(
        properties.segmentation().fallbackTitle(),
        properties.segmentation().failOnStraddlingSpan());
  }

  @Bean
  public VoiceSegmenter voiceSegmenter(SpeechTextCleaner speechTextCleaner) {
    return new VoiceSegmenter(speechTextCleaner);
  }

  @Bean
  public EnhancementValidator enhancementValidator(EnhancementProperties properties) {
    return new EnhancementValidator(
        properties.validation().maxSentenceLength(), properties.validation().minContentLength());
  }
}
