package com.scholary.audiobook.enhancer.speech;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reshapes body text for narration.
 *
 * <p>Cleans markdown, splits into sentences, puts a {@code [PAUSE]} before conjunctions of
 * sentences longer than the threshold, and turns markdown emphasis into {@code [EMPHASIS]} and
 * {@code [SLIGHT_EMPHASIS]} markers. Sentences are re-joined with {@code ". "}.
 */
public class SpeechOptimizer {

  /** Sentence terminators followed by whitespace or end of text, so decimals stay intact. */
  public static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?=\\s|$)");

  private static final Pattern CONJUNCTION =
      Pattern.compile("\\b(and|but|however|therefore|moreover|furthermore)\\b");
  private static final Pattern STRONG = Pattern.compile("\\*\\*([^*]+)\\*\\*");
  private static final Pattern EMPHASIS = Pattern.compile("\\*([^*]+)\\*");

  private final MarkdownSpeechCleaner cleaner;
  private final int longSentenceThreshold;

  public SpeechOptimizer(MarkdownSpeechCleaner cleaner, int longSentenceThreshold) {
    this.cleaner = cleaner;
    this.longSentenceThreshold = longSentenceThreshold;
  }

  public String optimize(String text) {
    String cleaned = cleaner.clean(text);
    if (cleaned.isEmpty()) {
      return "";
    }

    List<String> sentences = new ArrayList<>();
    for (String raw : SENTENCE_END.split(cleaned)) {
      String sentence = raw.strip();
      if (sentence.isEmpty()) {
        continue;
      }
      if (sentence.length() > longSentenceThreshold) {
        sentence = CONJUNCTION.matcher(sentence).replaceAll("[PAUSE] $1");
      }
      sentence = STRONG.matcher(sentence).replaceAll("[EMPHASIS] $1 [/EMPHASIS]");
      sentence = EMPHASIS.matcher(sentence).replaceAll("[SLIGHT_EMPHASIS] $1 [/SLIGHT_EMPHASIS]");
      sentences.add(sentence);
    }

    if (sentences.isEmpty()) {
      return "";
    }
    return String.join(". ", sentences) + ".";
  }
}
