package com.scholary.audiobook.enhancer.rewrite;

/** Rewriter used in {@link ProcessingMode#BASIC}. */
public class NoopTextRewriter implements TextRewriter {

  @Override
  public RewriteResult rewrite(String content) {
    return RewriteResult.unchanged(content);
  }

  @Override
  public String getProviderName() {
    return "none";
  }
}
