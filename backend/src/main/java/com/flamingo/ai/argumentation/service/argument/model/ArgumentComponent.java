package com.flamingo.ai.argumentation.service.argument.model;

import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import java.util.Arrays;
import java.util.List;

/**
 * A premise or conclusion span extracted from the source text.
 *
 * <p>{@code text} is the space-joined token texts, so it is not necessarily an exact substring of
 * the source. Components supplied by callers may lack offsets; both positions are then {@link
 * #UNKNOWN_POSITION}.
 *
 * @param kind premise or conclusion
 * @param text space-joined token texts
 * @param tokens the token texts of the span, in order
 * @param startPos smallest start offset among the span's tokens
 * @param endPos largest end offset among the span's tokens
 * @param sequenceOrder 0-based rank among components of the same kind
 */
public record ArgumentComponent(
    ComponentKind kind,
    String text,
    List<String> tokens,
    int startPos,
    int endPos,
    int sequenceOrder) {

  public static final int UNKNOWN_POSITION = -1;

  public ArgumentComponent {
    tokens = tokens == null ? List.of() : List.copyOf(tokens);
    if (startPos >= 0 && endPos >= 0 && startPos > endPos) {
      throw new IllegalArgumentException(
          "startPos " + startPos + " is after endPos " + endPos + " for " + kind);
    }
  }

  /** Creates a component without position information, tokenized on whitespace. */
  public static ArgumentComponent unpositioned(ComponentKind kind, String text, int sequenceOrder) {
    String stripped = text == null ? "" : text.strip();
    List<String> tokens =
        stripped.isEmpty() ? List.of() : Arrays.asList(stripped.split("\\s+"));
    return new ArgumentComponent(
        kind, stripped, tokens, UNKNOWN_POSITION, UNKNOWN_POSITION, sequenceOrder);
  }

  public boolean hasOffsets() {
    return startPos >= 0 && endPos >= startPos;
  }

  /** Center of the span, used to assign the component to a single paragraph. */
  public double midpoint() {
    return (startPos + endPos) / 2.0;
  }
}
