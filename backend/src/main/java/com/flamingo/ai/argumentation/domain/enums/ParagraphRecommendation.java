package com.flamingo.ai.argumentation.domain.enums;

/** Improvement hint attached to a scored paragraph. At most one applies per paragraph. */
public enum ParagraphRecommendation {
  /** No premises found. */
  ADD_PREMISES("Añade premisas que sustenten tus afirmaciones"),

  /** Premises but no conclusion. */
  ADD_CONCLUSION("Incluye conclusiones que sinteticen las ideas"),

  /** Components present but sparse relative to length. */
  INCREASE_DENSITY("Considera hacer el párrafo más conciso o añadir más argumentación"),

  /** Over 150 words. */
  SPLIT_PARAGRAPH("Párrafo extenso, considera dividirlo para mayor claridad");

  private final String message;

  ParagraphRecommendation(String message) {
    this.message = message;
  }

  public String getMessage() {
    return message;
  }
}
