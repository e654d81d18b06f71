package com.scholary.audiobook.enhancer.speech;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Final cleanup of a segment before it goes to a synthesis engine.
 *
 * <p>Emphasis and math markers are removed, {@code [PAUSE]} becomes a full stop, and whitespace
 * and stray punctuation are tidied.
 */
@Component
public class SpeechTextCleaner {

  private static final Pattern MARKERS =
      Pattern.compile("\\[/?(?:EMPHASIS|SLIGHT_EMPHASIS|MATH|MATH_BLOCK)\\]");
  private static final Pattern PAUSE = Pattern.compile("\\[PAUSE\\]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([.,;:!?])");
  private static final Pattern REPEATED_STOPS = Pattern.compile("\\.(?:\\s*\\.)+");

  public String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String cleaned = MARKERS.matcher(text).replaceAll(" ");
    cleaned = PAUSE.matcher(cleaned).replaceAll(".");
    cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
    cleaned = SPACE_BEFORE_PUNCTUATION.matcher(cleaned).replaceAll("$1");
    cleaned = REPEATED_STOPS.matcher(cleaned).replaceAll(".");
    cleaned = cleaned.strip();
    return cleaned.startsWith(".") ? cleaned.substring(1).strip() : cleaned;
  }
}
