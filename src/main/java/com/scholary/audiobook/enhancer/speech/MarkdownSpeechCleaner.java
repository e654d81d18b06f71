package com.scholary.audiobook.enhancer.speech;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Strips markdown that would otherwise be read aloud: heading hashes, horizontal rules,
 * blockquote and list markers, inline-code backticks and link targets.
 *
 * <p>The result is a single line with whitespace collapsed.
 */
@Component
public class MarkdownSpeechCleaner {

  private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+", Pattern.MULTILINE);
  private static final Pattern DASH_RULE = Pattern.compile("^---+$", Pattern.MULTILINE);
  private static final Pattern STAR_RULE = Pattern.compile("^\\*\\*\\*+$", Pattern.MULTILINE);
  private static final Pattern BLOCKQUOTE = Pattern.compile("^>\\s*", Pattern.MULTILINE);
  private static final Pattern BULLET = Pattern.compile("^\\s*[*+-]\\s+", Pattern.MULTILINE);
  private static final Pattern NUMBERED = Pattern.compile("^\\s*\\d+\\.\\s+", Pattern.MULTILINE);
  private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
  private static final Pattern INLINE_LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]+\\)");
  private static final Pattern REFERENCE_LINK = Pattern.compile("\\[([^\\]]+)\\]\\[[^\\]]*\\]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public String clean(String markdown) {
    if (markdown == null || markdown.isEmpty()) {
      return "";
    }
    String cleaned = HEADING.matcher(markdown).replaceAll("");
    cleaned = DASH_RULE.matcher(cleaned).replaceAll("");
    cleaned = STAR_RULE.matcher(cleaned).replaceAll("");
    cleaned = BLOCKQUOTE.matcher(cleaned).replaceAll("");
    cleaned = BULLET.matcher(cleaned).replaceAll("");
    cleaned = NUMBERED.matcher(cleaned).replaceAll("");
    cleaned = INLINE_CODE.matcher(cleaned).replaceAll("$1");
    cleaned = INLINE_LINK.matcher(cleaned).replaceAll("$1");
    cleaned = REFERENCE_LINK.matcher(cleaned).replaceAll("$1");
    return WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
  }
}
