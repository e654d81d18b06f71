package com.scholary.audiobook.enhancer.api;

import com.scholary.audiobook.enhancer.document.DocumentNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** One heading of a submitted document, with its own body and nested headings. */
public record HeadingRequest(
    @NotNull @Min(1) Integer depth,
    String title,
    String body,
    List<@NotNull @Valid HeadingRequest> children) {

  public HeadingRequest {
    if (children == null) {
      children = List.of();
    }
  }

  public DocumentNode toNode() {
    return new DocumentNode(
        depth, title, body, children.stream().map(HeadingRequest::toNode).toList());
  }
}
