package com.flamingo.ai.argumentation.api.dto.response;

import com.flamingo.ai.argumentation.service.argument.model.ArgumentSuggestion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an LLM suggestion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionResponse {

  private String componentType;
  private String originalText;
  private String suggestion;
  private String explanation;
  private boolean applied;

  public static SuggestionResponse fromSuggestion(ArgumentSuggestion suggestion) {
    return SuggestionResponse.builder()
        .componentType(suggestion.componentKind().getValue())
        .originalText(suggestion.originalText())
        .suggestion(suggestion.suggestion())
        .explanation(suggestion.explanation())
        .applied(suggestion.applied())
        .build();
  }
}
