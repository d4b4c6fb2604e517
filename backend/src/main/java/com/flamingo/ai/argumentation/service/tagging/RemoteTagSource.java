package com.flamingo.ai.argumentation.service.tagging;

import com.flamingo.ai.argumentation.service.argument.model.TaggedText;
import com.flamingo.ai.argumentation.service.argument.model.Token;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link TagSource} backed by the remote tagger server. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RemoteTagSource implements TagSource {

  private final TaggerClient taggerClient;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "tagging.tag", description = "Time to tokenize and label a text")
  @CircuitBreaker(name = "tagger", fallbackMethod = "tagFallback")
  @Retry(name = "tagger")
  public TaggedText tag(String text) {
    log.debug("Tagging text of {} chars", text.length());
    TaggerClient.TagResponse response = taggerClient.tag(text);
    if (response == null || response.tokens() == null) {
      log.warn("Tagger returned no tokens");
      return TaggedText.empty();
    }

    List<Token> tokens =
        response.tokens().stream()
            .map(t -> new Token(t.text(), t.pos(), t.start(), t.end()))
            .toList();
    meterRegistry.counter("tagging.requests.success").increment();

    log.debug(
        "Tagger returned {} tokens, {} labels",
        tokens.size(),
        response.labels() != null ? response.labels().size() : 0);
    return new TaggedText(tokens, response.labels());
  }

  /** Fallback when the tagger is unreachable: an empty result, which yields no components. */
  @SuppressWarnings("unused")
  TaggedText tagFallback(String text, Throwable t) {
    log.warn("Tagger unavailable, analyzing without components: {}", t.getMessage());
    meterRegistry.counter("tagging.fallback").increment();
    return TaggedText.empty();
  }

  @Override
  public boolean isAvailable() {
    try {
      return taggerClient.health();
    } catch (Exception e) {
      log.warn("Tagger health check failed: {}", e.getMessage());
      return false;
    }
  }
}
