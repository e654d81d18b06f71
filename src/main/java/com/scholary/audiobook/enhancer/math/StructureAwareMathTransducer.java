package com.scholary.audiobook.enhancer.math;

import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend that lets an external {@link MarkupParser} locate the math first, then applies the
 * pattern tables to each math node's payload.
 *
 * <p>When the parser fails or finds no math, the whole snippet goes through the regex backend.
 */
public class StructureAwareMathTransducer implements MathTransducer {

  private static final Logger LOGGER = LoggerFactory.getLogger(StructureAwareMathTransducer.class);

  private final MarkupParser parser;
  private final RegexMathTransducer fallback;

  public StructureAwareMathTransducer(MarkupParser parser, RegexMathTransducer fallback) {
    this.parser = parser;
    this.fallback = fallback;
  }

  @Override
  public String toSpeech(String latex, boolean block) {
    if (latex == null || latex.isBlank()) {
      return "";
    }

    String markup = block ? "$$\n" + latex + "\n$$" : "$" + latex.strip() + "$";
    try {
      List<MarkupNode> mathNodes = parser.parse(markup).mathNodes();
      if (mathNodes.isEmpty()) {
        LOGGER.warn("Markup parser found no math, using regex backend: latex={}", latex);
        return fallback.toSpeech(latex, block);
      }
      return mathNodes.stream()
          .map(node -> fallback.toSpeech(node.text(), node.display()))
          .filter(spoken -> !spoken.isEmpty())
          .collect(Collectors.joining(" "));
    } catch (MarkupParseException e) {
      LOGGER.warn("Markup parse failed, using regex backend: {}", e.getMessage());
      return fallback.toSpeech(latex, block);
    }
  }

  @Override
  public String getBackendName() {
    return "structure-aware";
  }
}
