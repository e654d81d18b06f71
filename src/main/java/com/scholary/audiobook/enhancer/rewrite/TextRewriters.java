package com.scholary.audiobook.enhancer.rewrite;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.enhancer.config.EnhancementProperties.RewriteProperties;

/** Picks the rewriter for a processing mode. */
public final class TextRewriters {

  private TextRewriters() {}

  /**
   * BASIC never rewrites; LOCAL_AI uses Ollama and API uses OpenAI when enabled; HYBRID prefers
   * Ollama and falls back to OpenAI. Anything not enabled means no rewrite.
   */
  public static TextRewriter forMode(
      ProcessingMode mode, RewriteProperties properties, ObjectMapper objectMapper) {
    boolean ollama = properties.ollama().enabled();
    boolean openai = properties.openai().enabled();

    switch (mode) {
      case LOCAL_AI:
        return ollama
            ? new OllamaTextRewriter(properties.ollama(), objectMapper)
            : new NoopTextRewriter();
      case API:
        return openai
            ? new OpenAiTextRewriter(properties.openai(), objectMapper)
            : new NoopTextRewriter();
      case HYBRID:
        if (ollama) {
          return new OllamaTextRewriter(properties.ollama(), objectMapper);
        }
        return openai
            ? new OpenAiTextRewriter(properties.openai(), objectMapper)
            : new NoopTextRewriter();
      case BASIC:
      default:
        return new NoopTextRewriter();
    }
  }
}
