package com.flamingo.ai.argumentation.service.argument.model;

/**
 * A token produced by the external tag source.
 *
 * @param text literal token text
 * @param posTag part-of-speech tag (e.g. {@code NOUN}); informational only
 * @param charStart character offset of the token in the source text, or {@code null}
 * @param charEnd exclusive end offset, or {@code null}
 */
public record Token(String text, String posTag, Integer charStart, Integer charEnd) {

  public Token {
    text = text == null ? "" : text;
  }

  /** Creates a token without offsets. */
  public static Token of(String text, String posTag) {
    return new Token(text, posTag, null, null);
  }

  /** Offsets only count as present when both ends are known and form a valid range. */
  public boolean hasOffsets() {
    return charStart != null && charEnd != null && charStart >= 0 && charStart <= charEnd;
  }
}
