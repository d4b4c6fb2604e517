package com.flamingo.ai.argumentation.api.dto.response;

import com.flamingo.ai.argumentation.service.argument.model.ParagraphAnalysis;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a scored paragraph. Density is rounded to 3 decimals. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParagraphAnalysisResponse {

  private String text;
  private int startPos;
  private int endPos;
  private String strength;
  private int strengthScore;
  private int premisesCount;
  private int conclusionsCount;
  private int wordCount;
  private double density;
  private String recommendation;
  private String recommendationCode;
  private int sequenceOrder;

  public static ParagraphAnalysisResponse fromAnalysis(ParagraphAnalysis paragraph, int order) {
    return ParagraphAnalysisResponse.builder()
        .text(paragraph.text())
        .startPos(paragraph.startPos())
        .endPos(paragraph.endPos())
        .strength(paragraph.strengthCategory().getLabel())
        .strengthScore(paragraph.strengthScore())
        .premisesCount(paragraph.premisesCount())
        .conclusionsCount(paragraph.conclusionsCount())
        .wordCount(paragraph.wordCount())
        .density(round(paragraph.density()))
        .recommendation(
            paragraph.recommendation() != null ? paragraph.recommendation().getMessage() : null)
        .recommendationCode(
            paragraph.recommendation() != null ? paragraph.recommendation().name() : null)
        .sequenceOrder(order)
        .build();
  }

  private static double round(double value) {
    return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
  }
}
