package com.scholary.audiobook.enhancer.math;

import java.util.regex.Pattern;

/**
 * One entry of a LaTeX-to-speech table: a matcher and the replacement template applied to every
 * match. Templates use {@code $n} group references; groups that did not take part in a match
 * expand to nothing.
 */
public record SpeechRule(Pattern pattern, String template) {

  /** A rule from a raw regular expression. */
  public static SpeechRule of(String regex, String template) {
    return new SpeechRule(Pattern.compile(regex), template);
  }

  /**
   * A rule for a LaTeX command with no arguments, e.g. {@code \alpha}.
   *
   * <p>Matches the whole command name only, so {@code \in} never fires inside {@code \infty}.
   */
  public static SpeechRule command(String name, String spoken) {
    return new SpeechRule(Pattern.compile("\\\\" + name + "(?![a-zA-Z])"), spoken);
  }

  /** A rule replacing a literal symbol, e.g. a Unicode operator. */
  public static SpeechRule symbol(String symbol, String spoken) {
    return new SpeechRule(Pattern.compile(Pattern.quote(symbol)), spoken);
  }

  public String apply(String input) {
    return pattern.matcher(input).replaceAll(template);
  }
}
