package com.scholary.audiobook.enhancer.speech;

import java.util.List;

/** Outcome of {@link EnhancementValidator}: valid exactly when there are no issues. */
public record ValidationReport(boolean valid, List<String> issues) {

  public ValidationReport {
    issues = List.copyOf(issues);
  }

  public static ValidationReport of(List<String> issues) {
    return new ValidationReport(issues.isEmpty(), issues);
  }
}
