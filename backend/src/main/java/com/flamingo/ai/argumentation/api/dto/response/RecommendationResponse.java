package com.flamingo.ai.argumentation.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for general recommendations. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {
  private String recommendations;
  private int totalPremises;
  private int totalConclusions;
}
