package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.TokenSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Run accumulator for one component class. Either {@code OUTSIDE} a span or {@code ACCUMULATING}
 * its tokens; {@link #close()} emits the open run and resets to {@code OUTSIDE}.
 *
 * <p>The run covers the smallest range holding all of its tokens' spans, so tokens whose
 * recovered offsets are out of order still yield {@code startPos <= endPos}.
 *
 * <p>Not thread-safe. One instance lives for the duration of a single extraction.
 */
final class SpanAccumulator {

  enum State {
    OUTSIDE,
    ACCUMULATING
  }

  private final ComponentKind kind;
  private final List<String> runTokens = new ArrayList<>();
  private State state = State.OUTSIDE;
  private int runStart;
  private int runEnd;
  private int emitted;

  SpanAccumulator(ComponentKind kind) {
    this.kind = kind;
  }

  void accept(String tokenText, TokenSpan span) {
    if (state == State.OUTSIDE) {
      runStart = span.start();
      runEnd = span.end();
      state = State.ACCUMULATING;
    } else {
      runStart = Math.min(runStart, span.start());
      runEnd = Math.max(runEnd, span.end());
    }
    runTokens.add(tokenText);
  }

  /** Emits the open run, if any. */
  Optional<ArgumentComponent> close() {
    if (state == State.OUTSIDE) {
      return Optional.empty();
    }
    ArgumentComponent component =
        new ArgumentComponent(
            kind, String.join(" ", runTokens), runTokens, runStart, runEnd, emitted++);
    runTokens.clear();
    state = State.OUTSIDE;
    return Optional.of(component);
  }

  ComponentKind kind() {
    return kind;
  }
}
