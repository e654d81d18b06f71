package com.scholary.audiobook.enhancer.pronunciation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes dictionary terms with their pronunciations.
 *
 * <p>Body text is matched case-insensitively on word boundaries. Titles are matched literally,
 * since a heading is short and usually written with the term's canonical casing.
 */
public class PronunciationApplier {

  private final PronunciationDictionary dictionary;
  private final List<CompiledTerm> terms;

  public PronunciationApplier(PronunciationDictionary dictionary) {
    this.dictionary = dictionary;
    this.terms = new ArrayList<>(dictionary.size());
    for (Map.Entry<String, String> entry : dictionary.asMap().entrySet()) {
      Pattern pattern =
          Pattern.compile(
              "\\b" + Pattern.quote(entry.getKey()) + "\\b",
              Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
      terms.add(new CompiledTerm(entry.getKey(), pattern, entry.getValue()));
    }
  }

  public String applyToBody(String text) {
    String result = text;
    for (CompiledTerm term : terms) {
      result = term.pattern().matcher(result).replaceAll(Matcher.quoteReplacement(term.spoken()));
    }
    return result;
  }

  public String applyToTitle(String title) {
    String result = title;
    for (CompiledTerm term : terms) {
      result = result.replace(term.term(), term.spoken());
    }
    return result;
  }

  public PronunciationDictionary getDictionary() {
    return dictionary;
  }

  private record CompiledTerm(String term, Pattern pattern, String spoken) {}
}
