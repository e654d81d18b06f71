package com.scholary.audiobook.enhancer.math;

/**
 * Converts a LaTeX snippet into spoken English.
 *
 * <p>Implementations never throw on unrecognised input: unknown commands are emitted unchanged.
 */
public interface MathTransducer {

  /**
   * Convert one expression.
   *
   * @param latex the expression without its delimiters, possibly malformed
   * @param block true for display math
   * @return the spoken form, whitespace-normalised
   */
  String toSpeech(String latex, boolean block);

  default String toSpeech(String latex) {
    return toSpeech(latex, false);
  }

  /** Short name used in logs and cache statistics. */
  String getBackendName();
}
