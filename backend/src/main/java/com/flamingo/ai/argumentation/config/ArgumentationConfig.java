package com.flamingo.ai.argumentation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the argument analysis pipeline. */
@Configuration
@ConfigurationProperties(prefix = "argumentation")
@Getter
@Setter
public class ArgumentationConfig {

  private Tagging tagging = new Tagging();
  private Paragraphs paragraphs = new Paragraphs();
  private Suggestions suggestions = new Suggestions();

  /** Connection to the external token-and-tag model server. */
  @Getter
  @Setter
  public static class Tagging {
    private boolean enabled = true;
    private String baseUrl = "http://localhost:8095";
    private String modelId = "crf-es-argument";

    /** Probe the tagger once when the application starts. */
    private boolean initializeOnStartup = true;

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
  }

  @Getter
  @Setter
  public static class Paragraphs {
    /** Candidates with fewer words than this are not analyzed. */
    private int minWords = 10;
  }

  @Getter
  @Setter
  public static class Suggestions {
    private boolean enabled = true;

    /** Upper bound on LLM calls per kind for one analysis. */
    private int maxPerKind = 20;
  }
}
