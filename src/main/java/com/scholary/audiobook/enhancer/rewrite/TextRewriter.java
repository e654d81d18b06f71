package com.scholary.audiobook.enhancer.rewrite;

/**
 * Optional generative pass over the finished buffer.
 *
 * <p>Implementations never throw: on any failure they return {@link RewriteResult#unchanged}.
 * Output length is not preserved, so offsets recorded before a changed rewrite are approximate.
 */
public interface TextRewriter {

  RewriteResult rewrite(String content);

  String getProviderName();
}
