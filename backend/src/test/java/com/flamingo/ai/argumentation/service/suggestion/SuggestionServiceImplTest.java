package com.flamingo.ai.argumentation.service.suggestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.argumentation.agent.ArgumentRecommendationAgent;
import com.flamingo.ai.argumentation.agent.ComponentSuggestionAgent;
import com.flamingo.ai.argumentation.config.ArgumentationConfig;
import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentSuggestion;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SuggestionServiceImpl Tests")
class SuggestionServiceImplTest {

  @Mock private ComponentSuggestionAgent componentSuggestionAgent;
  @Mock private ArgumentRecommendationAgent argumentRecommendationAgent;

  private ArgumentationConfig config;
  private SimpleMeterRegistry meterRegistry;
  private SuggestionServiceImpl service;

  @BeforeEach
  void setUp() {
    config = new ArgumentationConfig();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new SuggestionServiceImpl(
            componentSuggestionAgent, argumentRecommendationAgent, config, meterRegistry);
  }

  private static ArgumentComponent premise(String text, int order) {
    return ArgumentComponent.unpositioned(ComponentKind.PREMISE, text, order);
  }

  private static ArgumentComponent conclusion(String text, int order) {
    return ArgumentComponent.unpositioned(ComponentKind.CONCLUSION, text, order);
  }

  @Nested
  @DisplayName("Component suggestions")
  class ComponentSuggestions {

    @Test
    @DisplayName("Should produce one suggestion per component with its title")
    void shouldSuggestPerComponent() {
      when(componentSuggestionAgent.suggest("PREMISA", "el cielo es azul"))
          .thenReturn("  Aporta una fuente que respalde la observación.  ");
      when(componentSuggestionAgent.suggest("CONCLUSIÓN", "luego llueve"))
          .thenReturn("Explica por qué se sigue de la premisa.");

      List<ArgumentSuggestion> suggestions =
          service.suggestForComponents(
              List.of(premise("el cielo es azul", 0)), List.of(conclusion("luego llueve", 0)));

      assertThat(suggestions).hasSize(2);
      ArgumentSuggestion first = suggestions.get(0);
      assertThat(first.componentKind()).isEqualTo(ComponentKind.PREMISE);
      assertThat(first.originalText()).isEqualTo("el cielo es azul");
      assertThat(first.suggestion()).isEqualTo(SuggestionServiceImpl.PREMISE_TITLE);
      assertThat(first.explanation()).isEqualTo("Aporta una fuente que respalde la observación.");
      assertThat(first.applied()).isFalse();
      assertThat(suggestions.get(1).suggestion())
          .isEqualTo(SuggestionServiceImpl.CONCLUSION_TITLE);
    }

    @Test
    @DisplayName("Should skip a component whose suggestion fails")
    void shouldSkipFailedComponent() {
      when(componentSuggestionAgent.suggest("PREMISA", "primera"))
          .thenThrow(new RuntimeException("rate limited"));
      when(componentSuggestionAgent.suggest("PREMISA", "segunda")).thenReturn("Bien.");

      List<ArgumentSuggestion> suggestions =
          service.suggestForComponents(
              List.of(premise("primera", 0), premise("segunda", 1)), List.of());

      assertThat(suggestions)
          .extracting(ArgumentSuggestion::originalText)
          .containsExactly("segunda");
      assertThat(meterRegistry.counter("suggestion.failures", "type", "premise").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should cap the number of suggestions per kind")
    void shouldCapSuggestionsPerKind() {
      config.getSuggestions().setMaxPerKind(1);
      when(componentSuggestionAgent.suggest(anyString(), anyString())).thenReturn("Ok.");

      List<ArgumentSuggestion> suggestions =
          service.suggestForComponents(
              List.of(premise("a", 0), premise("b", 1)),
              List.of(conclusion("c", 0), conclusion("d", 1)));

      assertThat(suggestions)
          .extracting(ArgumentSuggestion::originalText)
          .containsExactly("a", "c");
      verify(componentSuggestionAgent, times(2)).suggest(anyString(), anyString());
    }

    @Test
    @DisplayName("Should not call the agent when suggestions are disabled")
    void shouldSkipWhenDisabled() {
      config.getSuggestions().setEnabled(false);

      assertThat(service.suggestForComponents(List.of(premise("a", 0)), List.of())).isEmpty();
      verify(componentSuggestionAgent, never()).suggest(anyString(), anyString());
    }
  }

  @Nested
  @DisplayName("General recommendations")
  class GeneralRecommendations {

    @Test
    @DisplayName("Should pass formatted components to the agent")
    void shouldFormatComponentsForAgent() {
      when(argumentRecommendationAgent.recommend(
              "Premisas:\n- el cielo es azul\n\nConclusiones:\n- luego llueve"))
          .thenReturn("Añade evidencia.\n");

      String result =
          service.generateRecommendations(List.of("el cielo es azul"), List.of("luego llueve"));

      assertThat(result).isEqualTo("Añade evidencia.");
    }

    @Test
    @DisplayName("Should fall back when nothing was extracted")
    void shouldFallBackWithoutComponents() {
      assertThat(service.generateRecommendations(List.of(), List.of()))
          .isEqualTo(SuggestionServiceImpl.FALLBACK_RECOMMENDATIONS);
      verify(argumentRecommendationAgent, never()).recommend(anyString());
    }

    @Test
    @DisplayName("Should fall back when the agent fails")
    void shouldFallBackOnAgentFailure() {
      when(argumentRecommendationAgent.recommend(anyString()))
          .thenThrow(new RuntimeException("timeout"));

      assertThat(service.generateRecommendations(List.of("p"), List.of()))
          .isEqualTo(SuggestionServiceImpl.FALLBACK_RECOMMENDATIONS);
      assertThat(
              meterRegistry.counter("suggestion.failures", "type", "recommendations").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fall back on a blank answer")
    void shouldFallBackOnBlankAnswer() {
      when(argumentRecommendationAgent.recommend(anyString())).thenReturn("   ");

      assertThat(service.generateRecommendations(List.of(), List.of("c")))
          .isEqualTo(SuggestionServiceImpl.FALLBACK_RECOMMENDATIONS);
    }

    @Test
    @DisplayName("Fallback text should list the three default recommendations")
    void fallbackTextShouldListDefaults() {
      assertThat(SuggestionServiceImpl.FALLBACK_RECOMMENDATIONS)
          .startsWith("Recomendaciones para mejorar tu argumento:\n\n")
          .contains("1. Fortalece las premisas con más evidencia")
          .endsWith("3. Considera contrargumentos");
    }
  }
}
