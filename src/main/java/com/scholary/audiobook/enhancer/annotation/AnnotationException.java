package com.scholary.audiobook.enhancer.annotation;

/**
 * Thrown when a document breaks an assumption of the traversal: a cycle in the heading tree, a
 * child no deeper than its parent, a depth below 1, or an offset outside the buffer.
 *
 * <p>Fatal for the document; no partial result is produced.
 */
public class AnnotationException extends RuntimeException {

  public AnnotationException(String message) {
    super(message);
  }
}
