package com.scholary.audiobook.enhancer.speech;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Quality checks on a finished buffer. Never throws; problems are reported as issues.
 *
 * <ul>
 *   <li>math delimiters left unconverted
 *   <li>sentences longer than the configured limit
 *   <li>unbalanced emphasis or slight-emphasis markers
 *   <li>content shorter than the configured minimum
 * </ul>
 */
public class EnhancementValidator {

  private static final Pattern INLINE_MATH = Pattern.compile("\\$[^$]+\\$");
  private static final Pattern BLOCK_MATH = Pattern.compile("\\$\\$[^$]+\\$\\$");

  private final int maxSentenceLength;
  private final int minContentLength;

  public EnhancementValidator(int maxSentenceLength, int minContentLength) {
    this.maxSentenceLength = maxSentenceLength;
    this.minContentLength = minContentLength;
  }

  public ValidationReport validate(String content) {
    List<String> issues = new ArrayList<>();
    String text = content == null ? "" : content;

    if (INLINE_MATH.matcher(text).find()) {
      issues.add("Unprocessed inline math expressions found");
    }
    if (BLOCK_MATH.matcher(text).find()) {
      issues.add("Unprocessed block math expressions found");
    }

    long longSentences =
        SpeechOptimizer.SENTENCE_END
            .splitAsStream(text)
            .filter(sentence -> sentence.strip().length() > maxSentenceLength)
            .count();
    if (longSentences > 0) {
      issues.add(
          String.format(
              "Found %d very long sentences that may be hard to narrate", longSentences));
    }

    if (count(text, "[EMPHASIS]") != count(text, "[/EMPHASIS]")) {
      issues.add("Unbalanced emphasis markers");
    }
    if (count(text, "[SLIGHT_EMPHASIS]") != count(text, "[/SLIGHT_EMPHASIS]")) {
      issues.add("Unbalanced slight emphasis markers");
    }

    if (text.strip().length() < minContentLength) {
      issues.add("Enhanced content is very short");
    }
    return ValidationReport.of(issues);
  }

  private static int count(String text, String marker) {
    int count = 0;
    int index = text.indexOf(marker);
    while (index >= 0) {
      count++;
      index = text.indexOf(marker, index + marker.length());
    }
    return count;
  }
}
