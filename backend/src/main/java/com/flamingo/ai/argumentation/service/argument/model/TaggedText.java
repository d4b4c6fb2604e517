package com.flamingo.ai.argumentation.service.argument.model;

import java.util.List;

/**
 * Output of the tag source: tokens and one BIO label per token.
 *
 * @param tokens ordered tokens
 * @param labels raw label strings, parallel to {@code tokens}; {@code null} when the source
 *     produced none
 */
public record TaggedText(List<Token> tokens, List<String> labels) {

  private static final TaggedText EMPTY = new TaggedText(List.of(), List.of());

  public TaggedText {
    tokens = tokens == null ? List.of() : tokens;
  }

  public static TaggedText empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return tokens.isEmpty() && (labels == null || labels.isEmpty());
  }
}
