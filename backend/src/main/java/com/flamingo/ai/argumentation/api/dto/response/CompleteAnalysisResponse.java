package com.flamingo.ai.argumentation.api.dto.response;

import com.flamingo.ai.argumentation.service.argument.model.ArgumentAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentSuggestion;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Complete analysis: components, paragraph metrics and suggestions. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteAnalysisResponse {

  private List<ArgumentComponentResponse> premises;
  private List<ArgumentComponentResponse> conclusions;
  @Builder.Default private List<SuggestionResponse> suggestions = new ArrayList<>();
  private List<ParagraphAnalysisResponse> paragraphAnalysis;
  private int totalPremises;
  private int totalConclusions;
  private Instant analyzedAt;

  public static CompleteAnalysisResponse from(
      ArgumentAnalysis analysis, List<ArgumentSuggestion> suggestions) {
    return CompleteAnalysisResponse.builder()
        .premises(
            analysis.premises().stream().map(ArgumentComponentResponse::fromComponent).toList())
        .conclusions(
            analysis.conclusions().stream().map(ArgumentComponentResponse::fromComponent).toList())
        .suggestions(suggestions.stream().map(SuggestionResponse::fromSuggestion).toList())
        .paragraphAnalysis(
            IntStream.range(0, analysis.paragraphs().size())
                .mapToObj(
                    i -> ParagraphAnalysisResponse.fromAnalysis(analysis.paragraphs().get(i), i))
                .toList())
        .totalPremises(analysis.totalPremises())
        .totalConclusions(analysis.totalConclusions())
        .analyzedAt(analysis.analyzedAt())
        .build();
  }
}
