package com.scholary.audiobook.enhancer.rewrite;

/** Which optional rewriter, if any, runs over the finished buffer. */
public enum ProcessingMode {
  /** No rewrite. */
  BASIC,
  /** Local Ollama model. */
  LOCAL_AI,
  /** Hosted OpenAI-compatible API. */
  API,
  /** Ollama when enabled, otherwise the hosted API. */
  HYBRID
}
