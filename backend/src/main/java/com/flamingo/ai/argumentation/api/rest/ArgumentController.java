package com.flamingo.ai.argumentation.api.rest;

import com.flamingo.ai.argumentation.api.dto.request.AnalysisRequest;
import com.flamingo.ai.argumentation.api.dto.request.ComponentPayload;
import com.flamingo.ai.argumentation.api.dto.request.ParagraphAnalysisRequest;
import com.flamingo.ai.argumentation.api.dto.request.TaggedAnalysisRequest;
import com.flamingo.ai.argumentation.api.dto.request.TokenPayload;
import com.flamingo.ai.argumentation.api.dto.response.AnalysisReportResponse;
import com.flamingo.ai.argumentation.api.dto.response.CompleteAnalysisResponse;
import com.flamingo.ai.argumentation.api.dto.response.ParagraphAnalysisResponse;
import com.flamingo.ai.argumentation.api.dto.response.RecommendationResponse;
import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import com.flamingo.ai.argumentation.service.argument.AnalysisReportFormatter;
import com.flamingo.ai.argumentation.service.argument.ArgumentAnalysisService;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentSuggestion;
import com.flamingo.ai.argumentation.service.argument.model.ExtractedComponents;
import com.flamingo.ai.argumentation.service.argument.model.ParagraphAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.TaggedText;
import com.flamingo.ai.argumentation.service.suggestion.SuggestionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for argument analysis. */
@RestController
@RequestMapping("/api/arguments")
@RequiredArgsConstructor
@Slf4j
public class ArgumentController {

  private final ArgumentAnalysisService argumentAnalysisService;
  private final SuggestionService suggestionService;
  private final AnalysisReportFormatter reportFormatter;

  /**
   * Tags the text, extracts premises and conclusions, scores paragraphs and optionally asks the
   * LLM for per-component suggestions.
   *
   * @param request the text to analyze
   * @return the complete analysis
   */
  @PostMapping("/analyze")
  public ResponseEntity<CompleteAnalysisResponse> analyze(
      @Valid @RequestBody AnalysisRequest request) {
    String text = request.getText().strip();
    log.info("Analyzing text: {} chars", text.length());

    ArgumentAnalysis analysis = argumentAnalysisService.analyze(text);
    List<ArgumentSuggestion> suggestions =
        Boolean.FALSE.equals(request.getIncludeSuggestions())
            ? List.of()
            : suggestionService.suggestForComponents(analysis.premises(), analysis.conclusions());

    return ResponseEntity.ok(CompleteAnalysisResponse.from(analysis, suggestions));
  }

  /**
   * Runs the analysis on tokens and labels produced by another tagger.
   *
   * @param request text, tokens and labels
   * @return the analysis without suggestions
   */
  @PostMapping("/analyze/tagged")
  public ResponseEntity<CompleteAnalysisResponse> analyzeTagged(
      @Valid @RequestBody TaggedAnalysisRequest request) {
    TaggedText tagged =
        new TaggedText(
            request.getTokens().stream().map(TokenPayload::toToken).toList(), request.getLabels());
    log.info("Analyzing pre-tagged text: {} tokens", tagged.tokens().size());

    ArgumentAnalysis analysis = argumentAnalysisService.analyzeTagged(request.getText(), tagged);
    return ResponseEntity.ok(CompleteAnalysisResponse.from(analysis, List.of()));
  }

  /**
   * Scores the paragraphs of a text against components supplied by the caller.
   *
   * @param request text and components
   * @return one entry per retained paragraph
   */
  @PostMapping("/paragraphs")
  public ResponseEntity<List<ParagraphAnalysisResponse>> analyzeParagraphs(
      @Valid @RequestBody ParagraphAnalysisRequest request) {
    List<ArgumentComponent> premises = toComponents(request.getPremises(), ComponentKind.PREMISE);
    List<ArgumentComponent> conclusions =
        toComponents(request.getConclusions(), ComponentKind.CONCLUSION);

    List<ParagraphAnalysis> paragraphs =
        argumentAnalysisService.analyzeParagraphs(request.getText(), premises, conclusions);
    List<ParagraphAnalysisResponse> response =
        IntStream.range(0, paragraphs.size())
            .mapToObj(i -> ParagraphAnalysisResponse.fromAnalysis(paragraphs.get(i), i))
            .toList();
    return ResponseEntity.ok(response);
  }

  /**
   * Writes general recommendations for the argument in the text.
   *
   * @param request the text to analyze
   * @return free-text recommendations
   */
  @PostMapping("/recommendations")
  public ResponseEntity<RecommendationResponse> recommendations(
      @Valid @RequestBody AnalysisRequest request) {
    ArgumentAnalysis analysis = argumentAnalysisService.analyze(request.getText().strip());
    String recommendations =
        suggestionService.generateRecommendations(
            analysis.premises().stream().map(ArgumentComponent::text).toList(),
            analysis.conclusions().stream().map(ArgumentComponent::text).toList());

    return ResponseEntity.ok(
        RecommendationResponse.builder()
            .recommendations(recommendations)
            .totalPremises(analysis.totalPremises())
            .totalConclusions(analysis.totalConclusions())
            .build());
  }

  /**
   * Lists the extracted premises and conclusions as a plain-text report.
   *
   * @param request the text to analyze
   * @return the report
   */
  @PostMapping("/report")
  public ResponseEntity<AnalysisReportResponse> report(
      @Valid @RequestBody AnalysisRequest request) {
    ArgumentAnalysis analysis = argumentAnalysisService.analyze(request.getText().strip());
    String report =
        reportFormatter.format(
            new ExtractedComponents(analysis.premises(), analysis.conclusions()));
    return ResponseEntity.ok(AnalysisReportResponse.builder().analysis(report).build());
  }

  private List<ArgumentComponent> toComponents(
      List<ComponentPayload> payloads, ComponentKind kind) {
    if (payloads == null) {
      return List.of();
    }
    return IntStream.range(0, payloads.size())
        .mapToObj(i -> payloads.get(i).toComponent(kind, i))
        .toList();
  }
}
