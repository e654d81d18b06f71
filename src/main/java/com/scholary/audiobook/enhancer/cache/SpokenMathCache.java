package com.scholary.audiobook.enhancer.cache;

import java.util.Optional;

/**
 * Cache of converted math expressions.
 *
 * <p>Academic texts repeat the same notation constantly, and the structure-aware backend spawns a
 * process per expression, so converted results are kept for reuse.
 */
public interface SpokenMathCache {

  /**
   * Store a spoken form.
   *
   * @param cacheKey key from {@link #generateKey}
   * @param spoken the converted expression
   */
  void put(String cacheKey, String spoken);

  /**
   * Look up a spoken form.
   *
   * @param cacheKey key from {@link #generateKey}
   * @return the cached spoken form, or empty if not found
   */
  Optional<String> get(String cacheKey);

  /** Drop every entry. */
  void clear();

  static String generateKey(String backend, boolean block, String latex) {
    return String.format("%s:%s:%s", backend, block ? "block" : "inline", latex);
  }
}
