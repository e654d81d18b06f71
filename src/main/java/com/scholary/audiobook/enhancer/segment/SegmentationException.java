package com.scholary.audiobook.enhancer.segment;

/** Thrown in strict mode when a voice span crosses a chapter boundary. */
public class SegmentationException extends RuntimeException {

  public SegmentationException(String message) {
    super(message);
  }
}
