package com.flamingo.ai.argumentation.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analyzing a text that was tagged by another system. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaggedAnalysisRequest {

  @NotBlank(message = "Text is required")
  private String text;

  @NotNull(message = "Tokens are required")
  @Valid
  private List<TokenPayload> tokens;

  /** One BIO label per token. */
  private List<String> labels;
}
