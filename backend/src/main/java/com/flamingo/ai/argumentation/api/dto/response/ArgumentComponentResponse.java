package com.flamingo.ai.argumentation.api.dto.response;

import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an extracted premise or conclusion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArgumentComponentResponse {

  private String componentType;
  private String text;
  private List<String> tokens;
  private Integer startPos;
  private Integer endPos;
  private int sequenceOrder;

  /** Creates a response from a component; unknown positions are serialized as null. */
  public static ArgumentComponentResponse fromComponent(ArgumentComponent component) {
    boolean positioned = component.hasOffsets();
    return ArgumentComponentResponse.builder()
        .componentType(component.kind().getValue())
        .text(component.text())
        .tokens(component.tokens())
        .startPos(positioned ? component.startPos() : null)
        .endPos(positioned ? component.endPos() : null)
        .sequenceOrder(component.sequenceOrder())
        .build();
  }
}
