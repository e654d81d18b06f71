package com.scholary.audiobook.enhancer.math;

import java.util.regex.Pattern;

/**
 * Pattern-table backend: the primary table, then the structural table.
 *
 * <p>Expressions longer than ten words get {@code [PAUSE]} markers after connective words so the
 * narrator breathes in the right places.
 */
public class RegexMathTransducer implements MathTransducer {

  private static final int PAUSE_WORD_THRESHOLD = 10;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern PAUSE_AFTER_VERB = Pattern.compile("\\b(equals?|is|are)\\s+");
  private static final Pattern PAUSE_AFTER_CONCLUSION =
      Pattern.compile("\\b(therefore|thus|hence)\\s+");
  private static final Pattern PAUSE_AFTER_CONDITION =
      Pattern.compile("\\b(where|such that|given that)\\s+");

  private final SpeechRuleTable primary;
  private final SpeechRuleTable structural;

  public RegexMathTransducer() {
    this(LatexSpeechRules.primary(), LatexSpeechRules.structural());
  }

  public RegexMathTransducer(SpeechRuleTable primary, SpeechRuleTable structural) {
    this.primary = primary;
    this.structural = structural;
  }

  @Override
  public String toSpeech(String latex, boolean block) {
    if (latex == null || latex.isBlank()) {
      return "";
    }

    String spoken = structural.apply(primary.apply(latex));
    spoken = WHITESPACE.matcher(spoken).replaceAll(" ").strip();

    if (spoken.split(" ").length > PAUSE_WORD_THRESHOLD) {
      spoken = PAUSE_AFTER_VERB.matcher(spoken).replaceAll("$1 [PAUSE] ");
      spoken = PAUSE_AFTER_CONCLUSION.matcher(spoken).replaceAll("$1 [PAUSE] ");
      spoken = PAUSE_AFTER_CONDITION.matcher(spoken).replaceAll("$1 [PAUSE] ");
      spoken = WHITESPACE.matcher(spoken).replaceAll(" ").strip();
    }
    return spoken;
  }

  @Override
  public String getBackendName() {
    return "regex";
  }
}
