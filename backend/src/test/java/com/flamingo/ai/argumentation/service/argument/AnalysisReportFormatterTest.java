package com.flamingo.ai.argumentation.service.argument;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ExtractedComponents;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnalysisReportFormatterTest {

  private final AnalysisReportFormatter formatter = new AnalysisReportFormatter();

  @Test
  void shouldListComponentsInOrder() {
    ExtractedComponents components =
        new ExtractedComponents(
            List.of(
                ArgumentComponent.unpositioned(ComponentKind.PREMISE, "cielo es", 0),
                ArgumentComponent.unpositioned(ComponentKind.PREMISE, "hace frío", 1)),
            List.of(ArgumentComponent.unpositioned(ComponentKind.CONCLUSION, "luego", 0)));

    assertThat(formatter.format(components))
        .isEqualTo(
            "Análisis del texto:\n\n"
                + "Premisas identificadas:\n"
                + "1. cielo es\n"
                + "2. hace frío\n"
                + "\n"
                + "Conclusiones identificadas:\n"
                + "1. luego\n");
  }

  @Test
  void shouldReportMissingComponents() {
    assertThat(formatter.format(ExtractedComponents.empty()))
        .isEqualTo(
            "Análisis del texto:\n\n"
                + "No se identificaron premisas claras.\n"
                + "\n"
                + "No se identificaron conclusiones claras.\n");
  }
}
