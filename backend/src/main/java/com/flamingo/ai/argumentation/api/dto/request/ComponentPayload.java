package com.flamingo.ai.argumentation.api.dto.request;

import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import com.flamingo.ai.argumentation.exception.InvalidComponentException;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import jakarta.validation.constraints.NotBlank;
import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A premise or conclusion supplied by the caller; positions are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentPayload {

  @NotBlank(message = "Component text is required")
  private String text;

  private Integer startPos;
  private Integer endPos;

  /**
   * Converts to a component; without both positions it is matched by text containment.
   *
   * @throws InvalidComponentException if the positions are negative or out of order
   */
  public ArgumentComponent toComponent(ComponentKind kind, int sequenceOrder) {
    if (startPos == null || endPos == null) {
      return ArgumentComponent.unpositioned(kind, text, sequenceOrder);
    }
    if (startPos < 0 || endPos < startPos) {
      throw new InvalidComponentException(
          String.format(
              "Invalid positions for %s #%d: startPos=%d, endPos=%d",
              kind.getValue(), sequenceOrder, startPos, endPos));
    }
    String stripped = text.strip();
    return new ArgumentComponent(
        kind, stripped, Arrays.asList(stripped.split("\\s+")), startPos, endPos, sequenceOrder);
  }
}
