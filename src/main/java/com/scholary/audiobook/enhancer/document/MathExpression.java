package com.scholary.audiobook.enhancer.document;

/**
 * A LaTeX expression found in a piece of text.
 *
 * <p>{@code start} and {@code end} are offsets into the text the expression was extracted from
 * and cover the delimiters as well ({@code $...$} or {@code $$...$$}). {@code latex} is the
 * trimmed payload between the delimiters.
 */
public record MathExpression(String latex, boolean block, int start, int end) {

  public MathExpression {
    if (start < 0) {
      throw new IllegalArgumentException("Math anchor cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("Math anchor end must be >= start");
    }
  }
}
