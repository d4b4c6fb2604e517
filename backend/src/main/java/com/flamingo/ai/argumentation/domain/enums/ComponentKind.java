package com.flamingo.ai.argumentation.domain.enums;

/** The two argumentative component classes extracted from text. */
public enum ComponentKind {
  PREMISE("premise", "PREMISA"),

  /** Also called "claim" by older model versions. */
  CONCLUSION("conclusion", "CONCLUSIÓN");

  private final String value;
  private final String displayName;

  ComponentKind(String value, String displayName) {
    this.value = value;
    this.displayName = displayName;
  }

  /** Lower-case wire value, e.g. {@code "premise"}. */
  public String getValue() {
    return value;
  }

  /** Spanish label used when prompting the suggestion agent. */
  public String getDisplayName() {
    return displayName;
  }
}
