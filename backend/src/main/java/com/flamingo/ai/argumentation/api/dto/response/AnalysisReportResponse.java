package com.flamingo.ai.argumentation.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the plain-text analysis report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReportResponse {
  private String analysis;
}
