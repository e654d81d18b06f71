package com.scholary.audiobook.enhancer.document;

import java.util.List;

/**
 * A parsed document: its title and top-level headings.
 *
 * <p>Produced by the external markdown parser and treated as read-only input.
 */
public record DocumentTree(String title, List<DocumentNode> chapters) {

  public DocumentTree {
    if (title == null || title.isBlank()) {
      title = "Untitled Document";
    }
    if (chapters == null) {
      chapters = List.of();
    }
  }

  public static DocumentTree of(DocumentNode... chapters) {
    return new DocumentTree(null, List.of(chapters));
  }
}
