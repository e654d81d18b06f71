package com.scholary.audiobook.enhancer.math;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the tree returned by a {@link MarkupParser}.
 *
 * <p>Only the distinction between literal text and math matters to the transducer; everything
 * else is a container.
 */
public record MarkupNode(Kind kind, String text, boolean display, List<MarkupNode> children) {

  public enum Kind {
    LITERAL,
    MATH,
    CONTAINER
  }

  public MarkupNode {
    if (text == null) {
      text = "";
    }
    children = children == null ? List.of() : List.copyOf(children);
  }

  public static MarkupNode literal(String text) {
    return new MarkupNode(Kind.LITERAL, text, false, List.of());
  }

  public static MarkupNode math(String latex, boolean display) {
    return new MarkupNode(Kind.MATH, latex, display, List.of());
  }

  public static MarkupNode container(List<MarkupNode> children) {
    return new MarkupNode(Kind.CONTAINER, "", false, children);
  }

  /** All math nodes under this one, in document order. */
  public List<MarkupNode> mathNodes() {
    List<MarkupNode> found = new ArrayList<>();
    collectMath(this, found);
    return found;
  }

  private static void collectMath(MarkupNode node, List<MarkupNode> found) {
    if (node.kind() == Kind.MATH) {
      found.add(node);
      return;
    }
    for (MarkupNode child : node.children()) {
      collectMath(child, found);
    }
  }
}
