package com.scholary.audiobook.enhancer.math;

import com.scholary.audiobook.enhancer.cache.SpokenMathCache;
import com.scholary.audiobook.enhancer.document.MathExpression;
import com.scholary.audiobook.enhancer.document.MathExpressionExtractor;
import com.scholary.audiobook.enhancer.logging.StructuredLogger;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces every math-delimited span of a text with its spoken form wrapped in
 * {@code [MATH] ... [/MATH]} or {@code [MATH_BLOCK] ... [/MATH_BLOCK]} markers.
 *
 * <p>The text is rebuilt left to right from the anchors, so replacements of different length
 * never shift the position of a later span.
 */
public class MathSpanProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(MathSpanProcessor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final MathTransducer transducer;
  private final RegexMathTransducer fallback;
  private final SpokenMathCache cache;
  private final MathExpressionExtractor extractor;

  public MathSpanProcessor(
      MathTransducer transducer,
      RegexMathTransducer fallback,
      SpokenMathCache cache,
      MathExpressionExtractor extractor) {
    this.transducer = transducer;
    this.fallback = fallback;
    this.cache = cache;
    this.extractor = extractor;
  }

  /** Convert all math in {@code text}, deriving anchors from the text itself. */
  public String process(String text) {
    return process(text, extractor.extract(text));
  }

  /**
   * Convert the given expressions of {@code text}.
   *
   * @param text the text the anchors point into
   * @param expressions anchors in ascending order
   * @return the text with every matching span replaced
   */
  public String process(String text, List<MathExpression> expressions) {
    if (expressions.isEmpty()) {
      return text;
    }

    StringBuilder result = new StringBuilder(text.length() + expressions.size() * 16);
    int cursor = 0;
    for (MathExpression expression : expressions) {
      if (!anchorMatches(text, expression, cursor)) {
        LOGGER.warn(
            "Math anchor does not match text, left unchanged: latex={}, anchor=[{}-{}]",
            expression.latex(),
            expression.start(),
            expression.end());
        continue;
      }

      result.append(text, cursor, expression.start());
      String spoken = speak(expression.latex(), expression.block());
      if (expression.block()) {
        result.append("[MATH_BLOCK] ").append(spoken).append(" [/MATH_BLOCK]");
      } else {
        result.append("[MATH] ").append(spoken).append(" [/MATH]");
      }
      cursor = expression.end();
    }
    result.append(text, cursor, text.length());
    return result.toString();
  }

  /** Spoken form of one expression, from the cache when possible. */
  public String speak(String latex, boolean block) {
    String key = SpokenMathCache.generateKey(transducer.getBackendName(), block, latex);
    return cache
        .get(key)
        .orElseGet(
            () -> {
              String spoken = convert(latex, block);
              cache.put(key, spoken);
              return spoken;
            });
  }

  private String convert(String latex, boolean block) {
    try {
      return transducer.toSpeech(latex, block);
    } catch (RuntimeException e) {
      STRUCTURED_LOGGER.logMathFallback(
          transducer.getBackendName(), latex, e.getClass().getSimpleName(), e.getMessage());
      return fallback.toSpeech(latex, block);
    }
  }

  private static boolean anchorMatches(String text, MathExpression expression, int cursor) {
    return expression.start() >= cursor
        && expression.end() > expression.start()
        && expression.end() <= text.length()
        && text.charAt(expression.start()) == '$'
        && text.charAt(expression.end() - 1) == '$'
        && text.substring(expression.start(), expression.end()).contains(expression.latex());
  }
}
