package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.domain.enums.ParagraphRecommendation;
import com.flamingo.ai.argumentation.domain.enums.StrengthCategory;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ParagraphAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.ParagraphSegment;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores located paragraphs by the argumentative components they contain.
 *
 * <p>A component belongs to the paragraph containing its midpoint, so a span crossing a paragraph
 * boundary is counted once. Components without offsets are matched by substring containment
 * instead.
 *
 * <p>Score: {@code 15} per premise, {@code 20} per conclusion, {@code +20} when density exceeds
 * {@value #DENSITY_BONUS_THRESHOLD}, {@code +10} when both kinds are present, and for paragraphs
 * with no components {@code -5} per full 50 words. Clamped to {@code [0, 100]}.
 */
@Component
@Slf4j
public class ParagraphScorer {

  static final int PREMISE_WEIGHT = 15;
  static final int CONCLUSION_WEIGHT = 20;
  static final double DENSITY_BONUS_THRESHOLD = 0.15;
  static final int DENSITY_BONUS = 20;
  static final int BALANCE_BONUS = 10;
  static final int LENGTH_PENALTY_WORDS = 50;
  static final int LENGTH_PENALTY = 5;
  static final double LOW_DENSITY_THRESHOLD = 0.1;
  static final int LONG_PARAGRAPH_WORDS = 150;

  /** Score and category computed together. */
  public record Strength(int score, StrengthCategory category) {}

  /**
   * Scores every paragraph.
   *
   * @param paragraphs located paragraphs
   * @param premises premises of the whole text
   * @param conclusions conclusions of the whole text
   * @return one analysis per paragraph, same order
   */
  public List<ParagraphAnalysis> score(
      List<ParagraphSegment> paragraphs,
      List<ArgumentComponent> premises,
      List<ArgumentComponent> conclusions) {
    List<ParagraphAnalysis> analyses =
        paragraphs.stream().map(p -> analyze(p, premises, conclusions)).toList();
    log.debug("Scored {} paragraphs", analyses.size());
    return analyses;
  }

  /** Scores a single paragraph. */
  public ParagraphAnalysis analyze(
      ParagraphSegment paragraph,
      List<ArgumentComponent> premises,
      List<ArgumentComponent> conclusions) {
    int premisesCount = countWithin(paragraph, premises);
    int conclusionsCount = countWithin(paragraph, conclusions);
    int wordCount = ParagraphSegmenter.countWords(paragraph.text());
    double density = density(premisesCount + conclusionsCount, wordCount);

    Strength strength = calculateStrength(premisesCount, conclusionsCount, wordCount, density);
    ParagraphRecommendation recommendation =
        recommend(premisesCount, conclusionsCount, density, wordCount);

    return new ParagraphAnalysis(
        paragraph.text(),
        paragraph.startPos(),
        paragraph.endPos(),
        wordCount,
        premisesCount,
        conclusionsCount,
        density,
        strength.score(),
        strength.category(),
        recommendation);
  }

  /** Components per word, {@code 0.0} when there are no words. */
  public static double density(int componentCount, int wordCount) {
    return wordCount > 0 ? (double) componentCount / wordCount : 0.0;
  }

  public Strength calculateStrength(
      int premisesCount, int conclusionsCount, int wordCount, double density) {
    int score = premisesCount * PREMISE_WEIGHT + conclusionsCount * CONCLUSION_WEIGHT;
    if (density > DENSITY_BONUS_THRESHOLD) {
      score += DENSITY_BONUS;
    }
    if (premisesCount > 0 && conclusionsCount > 0) {
      score += BALANCE_BONUS;
    }
    if (premisesCount + conclusionsCount == 0) {
      score -= (wordCount / LENGTH_PENALTY_WORDS) * LENGTH_PENALTY;
    }
    score = Math.max(0, Math.min(100, score));
    return new Strength(score, StrengthCategory.fromScore(score));
  }

  /**
   * First matching hint, in priority order.
   *
   * @return the recommendation, or {@code null} when the paragraph needs none
   */
  public ParagraphRecommendation recommend(
      int premisesCount, int conclusionsCount, double density, int wordCount) {
    if (premisesCount == 0) {
      return ParagraphRecommendation.ADD_PREMISES;
    }
    if (conclusionsCount == 0) {
      return ParagraphRecommendation.ADD_CONCLUSION;
    }
    if (density < LOW_DENSITY_THRESHOLD) {
      return ParagraphRecommendation.INCREASE_DENSITY;
    }
    if (wordCount > LONG_PARAGRAPH_WORDS) {
      return ParagraphRecommendation.SPLIT_PARAGRAPH;
    }
    return null;
  }

  private int countWithin(ParagraphSegment paragraph, List<ArgumentComponent> components) {
    int count = 0;
    for (ArgumentComponent component : components) {
      if (component.hasOffsets()) {
        double center = component.midpoint();
        if (paragraph.startPos() <= center && center < paragraph.endPos()) {
          count++;
        }
      } else if (paragraph.text().contains(component.text())) {
        count++;
      }
    }
    return count;
  }
}
