package com.flamingo.ai.argumentation.service.tagging;

import com.flamingo.ai.argumentation.config.ArgumentationConfig;
import com.flamingo.ai.argumentation.service.argument.model.TaggedText;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Process-wide handle on the tagging model.
 *
 * <p>{@link #ensureInitialized()} is idempotent: once the model has been reached it is not probed
 * again. While the model is not ready at most one caller probes it; everyone else gets "not ready"
 * immediately, so {@link #tag(String)} returns an empty result without waiting on the tagger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaggingModelService {

  private final TagSource tagSource;
  private final ArgumentationConfig config;

  private final AtomicBoolean probing = new AtomicBoolean();
  private volatile boolean ready;

  /**
   * Makes sure the model is reachable. Returns without probing when another caller's probe is
   * still in flight.
   *
   * @return true if the model is ready after this call
   */
  public boolean ensureInitialized() {
    if (ready) {
      return true;
    }
    if (!config.getTagging().isEnabled()) {
      log.debug("Tagging is disabled, model will not be initialized");
      return false;
    }
    if (!probing.compareAndSet(false, true)) {
      log.debug("Tagging model probe already in flight");
      return false;
    }
    try {
      if (tagSource.isAvailable()) {
        ready = true;
        log.info("Tagging model {} is ready", config.getTagging().getModelId());
      } else {
        log.warn(
            "Tagging model {} not available; argument extraction will return no components",
            config.getTagging().getModelId());
      }
    } finally {
      probing.set(false);
    }
    return ready;
  }

  public boolean isReady() {
    return ready;
  }

  /**
   * Tags a text, or returns an empty result when the model is not ready.
   *
   * @param text the text to tag
   * @return tokens and labels
   */
  public TaggedText tag(String text) {
    if (!ensureInitialized()) {
      return TaggedText.empty();
    }
    TaggedText tagged = tagSource.tag(text);
    return tagged != null ? tagged : TaggedText.empty();
  }
}
