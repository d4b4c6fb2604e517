package com.flamingo.ai.argumentation.api.dto.request;

import com.flamingo.ai.argumentation.service.argument.model.Token;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A token supplied by the caller; offsets are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenPayload {

  @NotNull(message = "Token text is required")
  private String text;

  private String pos;
  private Integer start;
  private Integer end;

  public Token toToken() {
    return new Token(text, pos, start, end);
  }
}
