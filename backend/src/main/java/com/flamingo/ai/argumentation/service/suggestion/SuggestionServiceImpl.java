package com.flamingo.ai.argumentation.service.suggestion;

import com.flamingo.ai.argumentation.agent.ArgumentRecommendationAgent;
import com.flamingo.ai.argumentation.agent.ComponentSuggestionAgent;
import com.flamingo.ai.argumentation.config.ArgumentationConfig;
import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentSuggestion;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link SuggestionService} using LLM agents. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SuggestionServiceImpl implements SuggestionService {

  static final String PREMISE_TITLE = "Fortalece esta premisa";
  static final String CONCLUSION_TITLE = "Mejora esta conclusión";
  static final String FALLBACK_RECOMMENDATIONS =
      """
      Recomendaciones para mejorar tu argumento:

      1. Fortalece las premisas con más evidencia
      2. Clarifica la conexión lógica
      3. Considera contrargumentos""";

  private final ComponentSuggestionAgent componentSuggestionAgent;
  private final ArgumentRecommendationAgent argumentRecommendationAgent;
  private final ArgumentationConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "suggestion.components", description = "Time to generate component suggestions")
  public List<ArgumentSuggestion> suggestForComponents(
      List<ArgumentComponent> premises, List<ArgumentComponent> conclusions) {
    if (!config.getSuggestions().isEnabled()) {
      log.debug("Suggestions disabled, skipping LLM calls");
      return List.of();
    }

    List<ArgumentSuggestion> suggestions = new ArrayList<>();
    suggestAll(premises, PREMISE_TITLE, suggestions);
    suggestAll(conclusions, CONCLUSION_TITLE, suggestions);

    log.debug(
        "Generated {} suggestions for {} components",
        suggestions.size(),
        premises.size() + conclusions.size());
    return suggestions;
  }

  @Override
  @Timed(value = "suggestion.recommendations", description = "Time to generate recommendations")
  public String generateRecommendations(List<String> premises, List<String> conclusions) {
    if (!config.getSuggestions().isEnabled() || (premises.isEmpty() && conclusions.isEmpty())) {
      return FALLBACK_RECOMMENDATIONS;
    }

    try {
      String result =
          argumentRecommendationAgent.recommend(formatComponents(premises, conclusions));
      if (result == null || result.isBlank()) {
        log.warn("Recommendation agent returned an empty answer, using fallback");
        return FALLBACK_RECOMMENDATIONS;
      }
      return result.strip();
    } catch (Exception e) {
      log.warn("Recommendation agent failed, using fallback: {}", e.getMessage());
      meterRegistry.counter("suggestion.failures", "type", "recommendations").increment();
      return FALLBACK_RECOMMENDATIONS;
    }
  }

  private void suggestAll(
      List<ArgumentComponent> components, String title, List<ArgumentSuggestion> sink) {
    int limit = config.getSuggestions().getMaxPerKind();
    for (ArgumentComponent component : components.stream().limit(limit).toList()) {
      ComponentKind kind = component.kind();
      try {
        String explanation =
            componentSuggestionAgent.suggest(kind.getDisplayName(), component.text());
        String advice = explanation == null ? "" : explanation.strip();
        sink.add(new ArgumentSuggestion(kind, component.text(), title, advice, false));
      } catch (Exception e) {
        log.warn(
            "Suggestion failed for {} #{}: {}",
            kind.getValue(),
            component.sequenceOrder(),
            e.getMessage());
        meterRegistry.counter("suggestion.failures", "type", kind.getValue()).increment();
      }
    }
  }

  private String formatComponents(List<String> premises, List<String> conclusions) {
    StringBuilder sb = new StringBuilder();
    if (!premises.isEmpty()) {
      sb.append("Premisas:\n")
          .append(premises.stream().map(p -> "- " + p).collect(Collectors.joining("\n")))
          .append("\n\n");
    }
    if (!conclusions.isEmpty()) {
      sb.append("Conclusiones:\n")
          .append(conclusions.stream().map(c -> "- " + c).collect(Collectors.joining("\n")))
          .append("\n\n");
    }
    return sb.toString().strip();
  }
}
