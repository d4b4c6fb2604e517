package com.flamingo.ai.argumentation.config;

import com.flamingo.ai.argumentation.service.tagging.TaggingModelService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that initializes the tagging model once when the application starts, so the first
 * analysis request does not pay for it. A tagger that is down at startup does not fail the
 * application; initialization is retried on the next analysis.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaggingModelStartupBean implements CommandLineRunner {

  private final TaggingModelService taggingModelService;
  private final ArgumentationConfig config;

  @Override
  public void run(String... args) {
    if (!config.getTagging().isInitializeOnStartup()) {
      log.info("Tagging model initialization on startup is disabled");
      return;
    }
    try {
      boolean ready = taggingModelService.ensureInitialized();
      log.info("Tagging model ready on startup: {}", ready);
    } catch (Exception e) {
      log.error("Tagging model initialization failed: {}", e.getMessage(), e);
    }
  }
}
