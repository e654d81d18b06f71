package com.scholary.audiobook.enhancer.rewrite;

/**
 * Result of a whole-buffer rewrite.
 *
 * <p>{@code changed == false} is the sentinel meaning the buffer is byte-for-byte the input, so
 * every offset recorded against it is still exact.
 */
public record RewriteResult(String content, boolean changed) {

  public static RewriteResult unchanged(String content) {
    return new RewriteResult(content, false);
  }

  /** A rewrite; collapses to {@link #unchanged} when the text did not actually change. */
  public static RewriteResult of(String original, String rewritten) {
    if (rewritten == null || rewritten.isBlank() || rewritten.equals(original)) {
      return unchanged(original);
    }
    return new RewriteResult(rewritten, true);
  }
}
