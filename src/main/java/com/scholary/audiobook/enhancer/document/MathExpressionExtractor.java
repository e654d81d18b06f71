package com.scholary.audiobook.enhancer.document;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds math-delimited spans in a piece of text.
 *
 * <p>Block spans ({@code $$...$$}, may cross lines) are matched before inline spans
 * ({@code $...$}, single line) in one left-to-right scan, so a {@code $} inside a block span is
 * never taken as an inline boundary.
 */
@Component
public class MathExpressionExtractor {

  /** Group 1 is block payload, group 2 is inline payload. */
  public static final Pattern MATH_SPAN =
      Pattern.compile("\\$\\$(.*?)\\$\\$|\\$([^$\\n]+?)\\$", Pattern.DOTALL);

  /**
   * Extract all math expressions with anchors into {@code text}.
   *
   * @param text the text to scan
   * @return expressions in ascending anchor order
   */
  public List<MathExpression> extract(String text) {
    List<MathExpression> expressions = new ArrayList<>();
    if (text == null || text.indexOf('$') < 0) {
      return expressions;
    }

    Matcher matcher = MATH_SPAN.matcher(text);
    while (matcher.find()) {
      boolean block = matcher.group(1) != null;
      String latex = block ? matcher.group(1) : matcher.group(2);
      expressions.add(new MathExpression(latex.strip(), block, matcher.start(), matcher.end()));
    }
    return expressions;
  }
}
