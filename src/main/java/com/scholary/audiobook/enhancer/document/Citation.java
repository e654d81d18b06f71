package com.scholary.audiobook.enhancer.document;

/**
 * An academic citation as written in the text, e.g. {@code (Smith, 1964)} or
 * {@code [Smith 1964]}.
 */
public record Citation(String original, String author, String year) {

  /** True for the {@code (Author, Year)} form, which is read with a comma. */
  public boolean commaStyle() {
    return original.contains(",");
  }
}
