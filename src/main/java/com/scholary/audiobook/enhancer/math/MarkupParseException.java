package com.scholary.audiobook.enhancer.math;

/**
 * Thrown when the external markup parser cannot produce a tree.
 *
 * <p>Callers recover by falling back to the regex backend.
 */
public class MarkupParseException extends Exception {

  public MarkupParseException(String message) {
    super(message);
  }

  public MarkupParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
