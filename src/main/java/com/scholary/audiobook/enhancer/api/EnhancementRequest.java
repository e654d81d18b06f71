package com.scholary.audiobook.enhancer.api;

import com.scholary.audiobook.enhancer.document.DocumentTree;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request to enhance a parsed document.
 *
 * <p>The document arrives already split into headings; math and citations are found in the body
 * text by the service.
 */
public record EnhancementRequest(
    String title, @NotEmpty List<@NotNull @Valid HeadingRequest> chapters) {

  public DocumentTree toTree() {
    return new DocumentTree(title, chapters.stream().map(HeadingRequest::toNode).toList());
  }
}
