package com.scholary.audiobook.enhancer.math;

import java.util.List;

/**
 * An ordered list of {@link SpeechRule}s applied one after another.
 *
 * <p>Order is significant: each rule sees the output of every rule before it.
 */
public final class SpeechRuleTable {

  private final List<SpeechRule> rules;

  public SpeechRuleTable(List<SpeechRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public String apply(String input) {
    String result = input;
    for (SpeechRule rule : rules) {
      result = rule.apply(result);
    }
    return result;
  }
}
