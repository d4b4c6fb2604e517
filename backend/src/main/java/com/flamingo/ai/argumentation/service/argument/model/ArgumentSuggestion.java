package com.flamingo.ai.argumentation.service.argument.model;

import com.flamingo.ai.argumentation.domain.enums.ComponentKind;

/**
 * LLM-generated improvement hint for one extracted component.
 *
 * @param componentKind kind of the component the suggestion targets
 * @param originalText the component text sent to the LLM
 * @param suggestion short title
 * @param explanation the LLM's advice
 * @param applied whether the user applied it; always {@code false} when generated
 */
public record ArgumentSuggestion(
    ComponentKind componentKind,
    String originalText,
    String suggestion,
    String explanation,
    boolean applied) {}
