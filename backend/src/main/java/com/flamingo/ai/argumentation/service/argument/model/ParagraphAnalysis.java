package com.flamingo.ai.argumentation.service.argument.model;

import com.flamingo.ai.argumentation.domain.enums.ParagraphRecommendation;
import com.flamingo.ai.argumentation.domain.enums.StrengthCategory;

/**
 * Argumentative metrics of a single paragraph.
 *
 * @param text paragraph text
 * @param startPos offset of the paragraph in the source text
 * @param endPos exclusive end offset
 * @param wordCount whitespace-delimited word count
 * @param premisesCount premises whose midpoint falls inside the paragraph
 * @param conclusionsCount conclusions whose midpoint falls inside the paragraph
 * @param density components per word, {@code 0.0} for an empty paragraph
 * @param strengthScore heuristic score in {@code [0, 100]}
 * @param strengthCategory qualitative tier of {@code strengthScore}
 * @param recommendation improvement hint, or {@code null} when none applies
 */
public record ParagraphAnalysis(
    String text,
    int startPos,
    int endPos,
    int wordCount,
    int premisesCount,
    int conclusionsCount,
    double density,
    int strengthScore,
    StrengthCategory strengthCategory,
    ParagraphRecommendation recommendation) {}
