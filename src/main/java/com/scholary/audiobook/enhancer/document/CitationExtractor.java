package com.scholary.audiobook.enhancer.document;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds author-year citations in a piece of text.
 *
 * <p>Recognised forms: {@code (Author, Year)}, {@code [Author Year]} and {@code (Author Year)}.
 * Authors are letters and spaces, years are exactly four digits.
 */
@Component
public class CitationExtractor {

  private static final List<Pattern> CITATION_PATTERNS =
      List.of(
          Pattern.compile("\\(([A-Za-z\\s]+),\\s*(\\d{4})\\)"),
          Pattern.compile("\\[([A-Za-z\\s]+)\\s+(\\d{4})\\]"),
          Pattern.compile("\\(([A-Za-z\\s]+)\\s+(\\d{4})\\)"));

  /**
   * Extract citations, de-duplicated by their original text.
   *
   * @param text the text to scan
   * @return citations in pattern order, then source order
   */
  public List<Citation> extract(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    Set<String> seen = new LinkedHashSet<>();
    List<Citation> citations = new ArrayList<>();
    for (Pattern pattern : CITATION_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        String original = matcher.group(0);
        if (seen.add(original)) {
          citations.add(
              new Citation(original, matcher.group(1).strip(), matcher.group(2).strip()));
        }
      }
    }
    return citations;
  }
}
