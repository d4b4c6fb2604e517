package com.flamingo.ai.argumentation.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for scoring paragraphs against components the caller already has. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParagraphAnalysisRequest {

  @NotBlank(message = "Text is required")
  private String text;

  @Valid @Builder.Default private List<ComponentPayload> premises = new ArrayList<>();

  @Valid @Builder.Default private List<ComponentPayload> conclusions = new ArrayList<>();
}
