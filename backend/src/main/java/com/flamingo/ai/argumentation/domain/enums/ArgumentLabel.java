package com.flamingo.ai.argumentation.domain.enums;

import java.util.HashMap;
import java.util.Map;

/**
 * BIO label assigned by the sequence model to each token.
 *
 * <p>{@code B-} marks the first token of a span and {@code I-} a continuation of the same class.
 * Parsing never fails: any value outside the tag set is read as {@link #O}. The long-form tags
 * ({@code B-Premise}, {@code I-Claim}, ...) emitted by older model versions are accepted as
 * aliases.
 */
public enum ArgumentLabel {
  B_P("B-P", ComponentKind.PREMISE),
  I_P("I-P", ComponentKind.PREMISE),
  B_C("B-C", ComponentKind.CONCLUSION),
  I_C("I-C", ComponentKind.CONCLUSION),
  O("O", null);

  private static final Map<String, ArgumentLabel> BY_TAG = new HashMap<>();

  static {
    for (ArgumentLabel label : values()) {
      BY_TAG.put(label.tag, label);
    }
    BY_TAG.put("B-Premise", B_P);
    BY_TAG.put("I-Premise", I_P);
    BY_TAG.put("B-Claim", B_C);
    BY_TAG.put("I-Claim", I_C);
  }

  private final String tag;
  private final ComponentKind kind;

  ArgumentLabel(String tag, ComponentKind kind) {
    this.tag = tag;
    this.kind = kind;
  }

  /**
   * Reads a raw tag produced by the tag source.
   *
   * @param raw the tag, may be {@code null}
   * @return the matching label, {@link #O} when unrecognized
   */
  public static ArgumentLabel parse(String raw) {
    if (raw == null) {
      return O;
    }
    return BY_TAG.getOrDefault(raw.strip(), O);
  }

  /** Returns true if this label opens or continues a span of the given class. */
  public boolean belongsTo(ComponentKind componentKind) {
    return kind == componentKind;
  }
}
