package com.scholary.audiobook.enhancer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Event logging with MDC fields.
 *
 * <p>Every event sets {@code event_type} plus its own fields and clears them again before
 * returning. The document context ({@code correlationId}, {@code documentTitle}) lives for the
 * whole enhancement run and is managed by the caller.
 */
public class StructuredLogger {

  public static final String CORRELATION_ID = "correlationId";
  public static final String DOCUMENT_TITLE = "documentTitle";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a node appended to the buffer. */
  public void logNodeAnnotated(
      int nodeIndex, int depth, String role, int start, int end, int bodyLength) {
    try {
      MDC.put("event_type", "node_annotated");
      MDC.put("node_index", String.valueOf(nodeIndex));
      MDC.put("depth", String.valueOf(depth));
      MDC.put("role", role);
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug(
          "Node annotated: index={}, depth={}, role={}, title=[{}-{}], body={} chars",
          nodeIndex,
          depth,
          role,
          start,
          end,
          bodyLength);
    } finally {
      clearEventFields();
    }
  }

  /** Log a math expression that fell back to the regex backend. */
  public void logMathFallback(String backend, String latex, String errorType, String message) {
    try {
      MDC.put("event_type", "math_fallback");
      MDC.put("backend", backend);
      MDC.put("errorType", errorType);

      logger.warn(
          "Math conversion failed, using regex backend: backend={}, latex={}, error={}, message={}",
          backend,
          latex,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of the whole-buffer rewrite. */
  public void logRewrite(
      String provider, boolean changed, int lengthBefore, int lengthAfter, long durationMs) {
    try {
      MDC.put("event_type", "rewrite");
      MDC.put("provider", provider);
      MDC.put("changed", String.valueOf(changed));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Rewrite finished: provider={}, changed={}, length={}->{}, duration={}ms",
          provider,
          changed,
          lengthBefore,
          lengthAfter,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a voice span dropped because it crosses a chapter boundary. */
  public void logSpanDropped(int chapterIndex, int start, int end, int boundary) {
    try {
      MDC.put("event_type", "span_dropped");
      MDC.put("chapter_index", String.valueOf(chapterIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.error(
          "Voice span straddles chapter boundary, dropped: chapter={}, span=[{}-{}], boundary={}",
          chapterIndex,
          start,
          end,
          boundary);
    } finally {
      clearEventFields();
    }
  }

  /** Log a finished document. */
  public void logDocumentEnhanced(
      int nodes, int length, int voiceSpans, int pauses, int chapters, long durationMs) {
    try {
      MDC.put("event_type", "document_enhanced");
      MDC.put("nodes", String.valueOf(nodes));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Document enhanced: nodes={}, length={}, voiceSpans={}, pauses={}, chapters={}, duration={}ms",
          nodes,
          length,
          voiceSpans,
          pauses,
          chapters,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress. */
  public void logJobProgress(String jobId, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, phase, percentComplete);
    } finally {
      clearEventFields();
      MDC.remove("jobId");
    }
  }

  /** Set document context in MDC. */
  public static void setDocumentContext(String correlationId, String documentTitle) {
    MDC.put(CORRELATION_ID, correlationId);
    MDC.put(DOCUMENT_TITLE, documentTitle);
  }

  /** Clear document context from MDC. */
  public static void clearDocumentContext() {
    MDC.remove(CORRELATION_ID);
    MDC.remove(DOCUMENT_TITLE);
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("node_index");
    MDC.remove("chapter_index");
    MDC.remove("depth");
    MDC.remove("role");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("backend");
    MDC.remove("errorType");
    MDC.remove("provider");
    MDC.remove("changed");
    MDC.remove("durationMs");
    MDC.remove("nodes");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
