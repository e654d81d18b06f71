package com.scholary.audiobook.enhancer.wrap;

import com.scholary.audiobook.enhancer.document.MathExpressionExtractor;
import com.scholary.audiobook.enhancer.math.SpeechRule;
import java.util.List;
import java.util.regex.Matcher;
import org.springframework.stereotype.Component;

/**
 * Wraps bare math notation in prose ({@code f(x)}, {@code E[X]}, {@code Var(X)}, {@code SD(X)},
 * {@code A ∩ B}, {@code A ∪ B}) in {@code $...$} so the math stage converts it.
 *
 * <p>Only text outside existing math spans is touched. A literal stretch that still contains a
 * {@code $} (an unmatched delimiter) is left alone entirely. The text is re-split after every
 * rule, so a rule never wraps text another rule has already wrapped.
 */
@Component
public class AutoMathWrapper {

  private static final List<SpeechRule> WRAP_RULES =
      List.of(
          SpeechRule.of("\\b([A-Za-z])\\(([^)]+)\\)", "\\$$1($2)\\$"),
          SpeechRule.of("\\bE\\[([^\\]]+)\\]", "\\$E[$1]\\$"),
          SpeechRule.of("\\bVar\\(([^)]+)\\)", "\\$\\\\text{Var}($1)\\$"),
          SpeechRule.of("\\bSD\\(([^)]+)\\)", "\\$\\\\text{SD}($1)\\$"),
          SpeechRule.of("([A-Z])\\s*∩\\s*([A-Z])", "\\$$1 \\\\cap $2\\$"),
          SpeechRule.of("([A-Z])\\s*∪\\s*([A-Z])", "\\$$1 \\\\cup $2\\$"));

  public String wrap(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String result = text;
    for (SpeechRule rule : WRAP_RULES) {
      result = applyOutsideMath(result, rule);
    }
    return result;
  }

  private static String applyOutsideMath(String text, SpeechRule rule) {
    StringBuilder result = new StringBuilder(text.length() + 8);
    Matcher matcher = MathExpressionExtractor.MATH_SPAN.matcher(text);
    int cursor = 0;
    while (matcher.find()) {
      result.append(wrapLiteral(text.substring(cursor, matcher.start()), rule));
      result.append(text, matcher.start(), matcher.end());
      cursor = matcher.end();
    }
    result.append(wrapLiteral(text.substring(cursor), rule));
    return result.toString();
  }

  private static String wrapLiteral(String literal, SpeechRule rule) {
    if (literal.isEmpty() || literal.indexOf('$') >= 0) {
      return literal;
    }
    return rule.apply(literal);
  }
}
