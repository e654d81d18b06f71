package com.scholary.audiobook.enhancer.annotation;

import com.scholary.audiobook.enhancer.document.DocumentNode;
import com.scholary.audiobook.enhancer.document.DocumentTree;
import com.scholary.audiobook.enhancer.logging.StructuredLogger;
import com.scholary.audiobook.enhancer.pronunciation.PronunciationApplier;
import com.scholary.audiobook.enhancer.rewrite.RewriteResult;
import com.scholary.audiobook.enhancer.rewrite.TextRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the speech-ready buffer for a document in one pre-order, depth-first pass.
 *
 * <p>For every heading, in order:
 *
 * <ol>
 *   <li>a 1.5 s pause, except before the first heading of the document
 *   <li>the title with pronunciations applied, covered by a voice span whose role follows the
 *       heading depth
 *   <li>a blank-line separator followed by a 2.5 s pause
 *   <li>a chapter break at the offset where step 1 began, paired with the original title
 *   <li>the enhanced body, if the heading has one, followed by a separator
 *   <li>the children, in source order
 * </ol>
 *
 * <p>Offsets are always read from the buffer after the text they describe has been appended, so
 * length changes made by the body pipeline can never leave a stale offset behind.
 *
 * <p>The optional rewriter runs once over the finished buffer. If it changes the buffer, the
 * result is flagged as having approximate offsets.
 */
public class AnnotationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationEngine.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String SEPARATOR = "\n\n";

  private final ContentEnhancer contentEnhancer;
  private final PronunciationApplier pronunciationApplier;
  private final TextRewriter rewriter;

  public AnnotationEngine(
      ContentEnhancer contentEnhancer,
      PronunciationApplier pronunciationApplier,
      TextRewriter rewriter) {
    this.contentEnhancer = contentEnhancer;
    this.pronunciationApplier = pronunciationApplier;
    this.rewriter = rewriter;
  }

  /**
   * Annotate a whole document.
   *
   * @param tree the parsed document
   * @return the buffer and its annotations
   * @throws AnnotationException if the tree violates the traversal's structural assumptions
   */
  public EnhancedText annotate(DocumentTree tree) {
    long startTime = System.currentTimeMillis();
    TraversalContext context = new TraversalContext();

    for (DocumentNode chapter : tree.chapters()) {
      visit(chapter, 0, context);
    }

    String content = context.content();
    checkOffsets(context, content.length());

    RewriteResult rewrite = rewrite(content);

    EnhancedText enhanced =
        new EnhancedText(
            rewrite.content(),
            context.voiceSpans(),
            context.pauseMarkers(),
            context.chapterBreaks(),
            context.chapterTitles(),
            pronunciationApplier.getDictionary().asMap(),
            !rewrite.changed());

    STRUCTURED_LOGGER.logDocumentEnhanced(
        context.nodesVisited(),
        enhanced.length(),
        enhanced.voiceSpans().size(),
        enhanced.pauseMarkers().size(),
        enhanced.chapterBreaks().size(),
        System.currentTimeMillis() - startTime);
    return enhanced;
  }

  private void visit(DocumentNode node, int parentDepth, TraversalContext context) {
    if (node == null) {
      throw new AnnotationException("Null heading in document tree");
    }

    int nodeIndex = context.enter(node);
    try {
      checkDepth(node, parentDepth);

      int breakOffset = context.cursor();
      if (!context.takeFirst()) {
        context.addPause(PauseMarker.BEFORE_HEADING);
      }

      VoiceRole role = VoiceRole.forDepth(node.depth());
      int titleStart = context.cursor();
      int titleEnd = context.append(pronunciationApplier.applyToTitle(node.title()));
      if (titleEnd > titleStart) {
        context.addVoiceSpan(titleStart, titleEnd, role);
      }

      context.append(SEPARATOR);
      context.addPause(PauseMarker.AFTER_HEADING);
      context.addChapterBreak(breakOffset, node.title());

      int bodyLength = 0;
      if (node.hasBody()) {
        String enhancedBody = contentEnhancer.enhance(node.body());
        if (!enhancedBody.isEmpty()) {
          context.append(enhancedBody);
          context.append(SEPARATOR);
          bodyLength = enhancedBody.length();
        }
      }

      STRUCTURED_LOGGER.logNodeAnnotated(
          nodeIndex, node.depth(), role.name(), titleStart, titleEnd, bodyLength);

      for (DocumentNode child : node.children()) {
        visit(child, node.depth(), context);
      }
    } finally {
      context.exit(node);
    }
  }

  private static void checkDepth(DocumentNode node, int parentDepth) {
    if (node.depth() < 1) {
      throw new AnnotationException(
          String.format("Heading '%s' has depth %d, must be >= 1", node.title(), node.depth()));
    }
    if (node.depth() <= parentDepth) {
      throw new AnnotationException(
          String.format(
              "Heading '%s' at depth %d is not deeper than its parent at depth %d",
              node.title(), node.depth(), parentDepth));
    }
  }

  private RewriteResult rewrite(String content) {
    if (content.isBlank()) {
      return RewriteResult.unchanged(content);
    }
    long startTime = System.currentTimeMillis();
    RewriteResult result = rewriter.rewrite(content);
    STRUCTURED_LOGGER.logRewrite(
        rewriter.getProviderName(),
        result.changed(),
        content.length(),
        result.content().length(),
        System.currentTimeMillis() - startTime);
    return result;
  }

  private static void checkOffsets(TraversalContext context, int length) {
    for (VoiceSpan span : context.voiceSpans()) {
      requireInBuffer(span.end(), length, "voice span end");
    }
    for (PauseMarker pause : context.pauseMarkers()) {
      requireInBuffer(pause.offset(), length, "pause marker");
    }
    for (int offset : context.chapterBreaks()) {
      requireInBuffer(offset, length, "chapter break");
    }
  }

  private static void requireInBuffer(int offset, int length, String what) {
    if (offset < 0 || offset > length) {
      throw new AnnotationException(
          String.format("%s offset %d outside buffer of length %d", what, offset, length));
    }
  }
}
