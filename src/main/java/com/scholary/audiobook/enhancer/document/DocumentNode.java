package com.scholary.audiobook.enhancer.document;

import java.util.List;

/**
 * One heading of a parsed document with its own body text and nested headings.
 *
 * <p>The body holds only the text between this heading and the next heading of any level;
 * descendant content lives in {@code children}, in source order. Depth increases strictly from
 * parent to child but may skip levels (a depth-2 heading may directly contain a depth-4 one).
 */
public record DocumentNode(int depth, String title, String body, List<DocumentNode> children) {

  public DocumentNode {
    if (title == null) {
      title = "";
    }
    if (body == null) {
      body = "";
    }
    if (children == null) {
      children = List.of();
    }
  }

  /** Create a node without children. */
  public static DocumentNode leaf(int depth, String title, String body) {
    return new DocumentNode(depth, title, body, List.of());
  }

  public boolean hasBody() {
    return !body.isBlank();
  }
}
