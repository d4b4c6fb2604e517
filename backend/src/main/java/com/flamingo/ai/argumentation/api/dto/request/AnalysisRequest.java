package com.flamingo.ai.argumentation.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analyzing a text with the tagging model. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

  @NotBlank(message = "Text is required")
  @Size(max = 50000, message = "Text must not exceed 50000 characters")
  private String text;

  /** Ask the LLM for one suggestion per extracted component. */
  @Builder.Default private Boolean includeSuggestions = Boolean.TRUE;
}
