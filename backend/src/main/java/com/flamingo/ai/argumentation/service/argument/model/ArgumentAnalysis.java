package com.flamingo.ai.argumentation.service.argument.model;

import java.time.Instant;
import java.util.List;

/**
 * Result of one analysis call.
 *
 * @param premises extracted premises in text order
 * @param conclusions extracted conclusions in text order
 * @param paragraphs per-paragraph metrics in text order
 * @param analyzedAt when the analysis completed
 */
public record ArgumentAnalysis(
    List<ArgumentComponent> premises,
    List<ArgumentComponent> conclusions,
    List<ParagraphAnalysis> paragraphs,
    Instant analyzedAt) {

  public ArgumentAnalysis {
    premises = List.copyOf(premises);
    conclusions = List.copyOf(conclusions);
    paragraphs = List.copyOf(paragraphs);
  }

  public int totalPremises() {
    return premises.size();
  }

  public int totalConclusions() {
    return conclusions.size();
  }
}
