package com.scholary.audiobook.enhancer.annotation;

import com.scholary.audiobook.enhancer.document.DocumentNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one traversal: the growing buffer and everything anchored to it.
 *
 * <p>The write cursor is always the buffer length, so offsets can never drift from the text.
 */
final class TraversalContext {

  private final StringBuilder buffer = new StringBuilder();
  private final List<VoiceSpan> voiceSpans = new ArrayList<>();
  private final List<PauseMarker> pauseMarkers = new ArrayList<>();
  private final List<Integer> chapterBreaks = new ArrayList<>();
  private final List<String> chapterTitles = new ArrayList<>();
  private final Set<DocumentNode> path = Collections.newSetFromMap(new IdentityHashMap<>());

  private boolean firstNode = true;
  private int nodesVisited;

  int cursor() {
    return buffer.length();
  }

  /** Append text and return the new cursor. */
  int append(String text) {
    buffer.append(text);
    return buffer.length();
  }

  void addPause(double durationSeconds) {
    pauseMarkers.add(new PauseMarker(cursor(), durationSeconds));
  }

  void addVoiceSpan(int start, int end, VoiceRole role) {
    voiceSpans.add(new VoiceSpan(start, end, role));
  }

  void addChapterBreak(int offset, String originalTitle) {
    if (!chapterBreaks.isEmpty() && offset <= chapterBreaks.get(chapterBreaks.size() - 1)) {
      throw new AnnotationException(
          String.format(
              "Chapter break %d does not follow previous break %d",
              offset, chapterBreaks.get(chapterBreaks.size() - 1)));
    }
    chapterBreaks.add(offset);
    chapterTitles.add(originalTitle);
  }

  /** True only for the first node of the document. */
  boolean takeFirst() {
    boolean first = firstNode;
    firstNode = false;
    return first;
  }

  /**
   * Mark a node as being on the current root-to-node path.
   *
   * @return the index of this node in visiting order
   * @throws AnnotationException if the node is already on the path
   */
  int enter(DocumentNode node) {
    if (!path.add(node)) {
      throw new AnnotationException(
          String.format("Cycle in document tree at heading '%s'", node.title()));
    }
    return nodesVisited++;
  }

  void exit(DocumentNode node) {
    path.remove(node);
  }

  String content() {
    return buffer.toString();
  }

  List<VoiceSpan> voiceSpans() {
    return voiceSpans;
  }

  List<PauseMarker> pauseMarkers() {
    return pauseMarkers;
  }

  List<Integer> chapterBreaks() {
    return chapterBreaks;
  }

  List<String> chapterTitles() {
    return chapterTitles;
  }

  int nodesVisited() {
    return nodesVisited;
  }
}
