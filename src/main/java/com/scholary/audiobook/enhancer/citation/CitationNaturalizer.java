package com.scholary.audiobook.enhancer.citation;

import com.scholary.audiobook.enhancer.document.Citation;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Replaces citation tokens with how a narrator would say them.
 *
 * <p>{@code (Smith, 1964)} becomes {@code Smith, nineteen sixty-four}; the comma is kept only
 * when the original citation had one.
 */
@Component
public class CitationNaturalizer {

  public String speak(Citation citation) {
    String year = YearSpeller.speak(citation.year());
    return citation.commaStyle()
        ? citation.author() + ", " + year
        : citation.author() + " " + year;
  }

  /**
   * Replace every occurrence of each citation's original text.
   *
   * @param text the text to rewrite
   * @param citations citations found in {@code text}
   * @return the rewritten text
   */
  public String naturalize(String text, List<Citation> citations) {
    String result = text;
    for (Citation citation : citations) {
      result = result.replace(citation.original(), speak(citation));
    }
    return result;
  }
}
