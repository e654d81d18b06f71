package com.scholary.audiobook.enhancer.rewrite;

/**
 * Thrown inside a rewriter when the provider fails or answers with something unusable.
 *
 * <p>Never escapes a {@link TextRewriter}.
 */
public class RewriteException extends RuntimeException {

  public RewriteException(String message) {
    super(message);
  }

  public RewriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
