package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.service.argument.model.Token;
import com.flamingo.ai.argumentation.service.argument.model.TokenSpan;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@code [start, end)} character range for every token.
 *
 * <p>When all tokens carry offsets they are passed through unchanged. Otherwise tokens are walked
 * left to right with a cursor: tokens with offsets keep them, tokens without are located by literal
 * search from the cursor. The cursor only moves forward, so a repeated word is never matched to an
 * earlier occurrence. A token that cannot be found (normalization differences between the tagger
 * and the text) is placed at the cursor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OffsetAligner {

  private final MeterRegistry meterRegistry;

  /**
   * Aligns tokens to the source text.
   *
   * @param tokens tokens from the tag source
   * @param text the original text
   * @return one span per token, parallel to {@code tokens}
   */
  public List<TokenSpan> align(List<Token> tokens, String text) {
    if (tokens.isEmpty()) {
      return List.of();
    }
    if (tokens.stream().allMatch(Token::hasOffsets)) {
      return tokens.stream().map(t -> new TokenSpan(t.charStart(), t.charEnd())).toList();
    }

    List<TokenSpan> spans = new ArrayList<>(tokens.size());
    int cursor = 0;
    int approximated = 0;

    for (Token token : tokens) {
      if (token.hasOffsets()) {
        spans.add(new TokenSpan(token.charStart(), token.charEnd()));
        cursor = token.charEnd();
        continue;
      }

      String tokenText = token.text();
      int found = cursor <= text.length() ? text.indexOf(tokenText, cursor) : -1;
      int start;
      if (found >= 0) {
        start = found;
      } else {
        start = cursor;
        approximated++;
      }
      int end = start + tokenText.length();
      spans.add(new TokenSpan(start, end));
      cursor = end;
    }

    if (approximated > 0) {
      log.debug(
          "Placed {} of {} tokens at cursor position (not found in text)",
          approximated,
          tokens.size());
      meterRegistry.counter("argument.offsets.approximated").increment(approximated);
    }
    return spans;
  }
}
