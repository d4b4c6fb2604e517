package com.flamingo.ai.argumentation.domain.enums;

/** Four-tier qualitative label for a paragraph's strength score. */
public enum StrengthCategory {
  MUY_FUERTE("muy fuerte", 70),
  FUERTE("fuerte", 50),
  MODERADA("moderada", 30),
  DEBIL("débil", 0);

  private final String label;
  private final int minScore;

  StrengthCategory(String label, int minScore) {
    this.label = label;
    this.minScore = minScore;
  }

  /**
   * Maps a clamped score to its category. Thresholds are inclusive lower bounds.
   *
   * @param score strength score in {@code [0, 100]}
   * @return the highest category whose threshold the score reaches
   */
  public static StrengthCategory fromScore(int score) {
    for (StrengthCategory category : values()) {
      if (score >= category.minScore) {
        return category;
      }
    }
    return DEBIL;
  }

  public String getLabel() {
    return label;
  }
}
