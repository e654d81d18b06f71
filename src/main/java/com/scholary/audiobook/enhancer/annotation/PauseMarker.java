package com.scholary.audiobook.enhancer.annotation;

/** Silence of {@code durationSeconds} inserted at a buffer offset. */
public record PauseMarker(int offset, double durationSeconds) {

  public static final double BEFORE_HEADING = 1.5;
  public static final double AFTER_HEADING = 2.5;

  public PauseMarker {
    if (offset < 0) {
      throw new IllegalArgumentException("Pause offset cannot be negative: " + offset);
    }
  }

  public PauseMarker shift(int delta) {
    return new PauseMarker(offset - delta, durationSeconds);
  }
}
