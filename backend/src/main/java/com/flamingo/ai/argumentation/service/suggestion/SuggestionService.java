package com.flamingo.ai.argumentation.service.suggestion;

import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentSuggestion;
import java.util.List;

/** Service interface for LLM-generated improvement suggestions. */
public interface SuggestionService {

  /**
   * Asks the LLM for one suggestion per component. Components whose call fails are skipped.
   *
   * @param premises extracted premises
   * @param conclusions extracted conclusions
   * @return suggestions, premises first, in component order
   */
  List<ArgumentSuggestion> suggestForComponents(
      List<ArgumentComponent> premises, List<ArgumentComponent> conclusions);

  /**
   * Writes general recommendations for the whole argument. Falls back to a fixed checklist when
   * nothing was extracted or the LLM is unavailable.
   *
   * @param premises premise texts
   * @param conclusions conclusion texts
   * @return free-text recommendations
   */
  String generateRecommendations(List<String> premises, List<String> conclusions);
}
