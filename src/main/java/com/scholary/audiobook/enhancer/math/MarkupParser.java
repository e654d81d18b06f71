package com.scholary.audiobook.enhancer.math;

/** External parser turning markup into a tree that separates literal text from math. */
public interface MarkupParser {

  /** Whether the parser can be used in this environment. */
  boolean isAvailable();

  /**
   * Parse a snippet of markdown with embedded math.
   *
   * @throws MarkupParseException if the parser fails, times out or returns unreadable output
   */
  MarkupNode parse(String markup) throws MarkupParseException;
}
