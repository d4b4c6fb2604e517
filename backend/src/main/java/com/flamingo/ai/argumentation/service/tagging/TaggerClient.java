package com.flamingo.ai.argumentation.service.tagging;

import com.flamingo.ai.argumentation.config.ArgumentationConfig;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the token-and-tag model server. Encapsulates all WebClient communication with
 * the tagger container.
 */
@Component
@Slf4j
public class TaggerClient {

  private final WebClient webClient;
  private final int connectTimeoutMs;
  private final int readTimeoutMs;

  public TaggerClient(ArgumentationConfig config) {
    ArgumentationConfig.Tagging tagging = config.getTagging();
    this.connectTimeoutMs = tagging.getConnectTimeoutMs();
    this.readTimeoutMs = tagging.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(tagging.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
            .build();
    log.info(
        "Tagger client initialized: baseUrl={}, model={}",
        tagging.getBaseUrl(),
        tagging.getModelId());
  }

  /**
   * Calls the tagger /tag endpoint.
   *
   * @param text the text to tag
   * @return tokens and labels as returned by the tagger
   */
  public TagResponse tag(String text) {
    return webClient
        .post()
        .uri("/tag")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(new TagRequest(text))
        .retrieve()
        .bodyToMono(TagResponse.class)
        .timeout(Duration.ofMillis(readTimeoutMs))
        .block();
  }

  /**
   * Calls the tagger /health endpoint.
   *
   * @return true on a 2xx response
   */
  public boolean health() {
    var response =
        webClient
            .get()
            .uri("/health")
            .retrieve()
            .toBodilessEntity()
            .timeout(Duration.ofMillis(connectTimeoutMs))
            .block();
    return response != null && response.getStatusCode().is2xxSuccessful();
  }

  record TagRequest(String text) {}

  /** Tagger response body. */
  public record TagResponse(List<TaggedToken> tokens, List<String> labels) {}

  /** One token as serialized by the tagger; offsets may be absent. */
  public record TaggedToken(String text, String pos, Integer start, Integer end) {}
}
