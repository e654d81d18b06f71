package com.scholary.audiobook.enhancer.annotation;

/** A {@code [start, end)} range of the buffer read with one voice. */
public record VoiceSpan(int start, int end, VoiceRole role) {

  public VoiceSpan {
    if (start < 0) {
      throw new IllegalArgumentException("Voice span start cannot be negative: " + start);
    }
    if (end <= start) {
      throw new IllegalArgumentException(
          String.format("Voice span must be non-empty: [%d-%d]", start, end));
    }
  }

  /** The same span moved left by {@code offset}. */
  public VoiceSpan shift(int offset) {
    return new VoiceSpan(start - offset, end - offset, role);
  }
}
