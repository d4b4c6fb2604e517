package com.flamingo.ai.argumentation.service.argument.model;

import java.util.List;

/**
 * Premises and conclusions decoded from one tag sequence, each in text order.
 *
 * @param premises premise components
 * @param conclusions conclusion components
 */
public record ExtractedComponents(
    List<ArgumentComponent> premises, List<ArgumentComponent> conclusions) {

  public ExtractedComponents {
    premises = List.copyOf(premises);
    conclusions = List.copyOf(conclusions);
  }

  public static ExtractedComponents empty() {
    return new ExtractedComponents(List.of(), List.of());
  }
}
