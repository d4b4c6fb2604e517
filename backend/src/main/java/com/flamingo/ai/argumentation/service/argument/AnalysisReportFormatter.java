package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ExtractedComponents;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders extracted components as the plain-text summary shown in the conversation view. */
@Component
public class AnalysisReportFormatter {

  static final String HEADER = "Análisis del texto:\n\n";

  public String format(ExtractedComponents components) {
    StringBuilder report = new StringBuilder(HEADER);
    appendSection(
        report,
        components.premises(),
        "Premisas identificadas:\n",
        "No se identificaron premisas claras.\n");
    report.append('\n');
    appendSection(
        report,
        components.conclusions(),
        "Conclusiones identificadas:\n",
        "No se identificaron conclusiones claras.\n");
    return report.toString();
  }

  private void appendSection(
      StringBuilder report, List<ArgumentComponent> components, String title, String emptyText) {
    if (components.isEmpty()) {
      report.append(emptyText);
      return;
    }
    report.append(title);
    for (int i = 0; i < components.size(); i++) {
      report.append(i + 1).append(". ").append(components.get(i).text()).append('\n');
    }
  }
}
