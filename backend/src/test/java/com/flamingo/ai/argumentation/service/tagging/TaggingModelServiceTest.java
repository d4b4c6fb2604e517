package com.flamingo.ai.argumentation.service.tagging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.argumentation.config.ArgumentationConfig;
import com.flamingo.ai.argumentation.service.argument.model.TaggedText;
import com.flamingo.ai.argumentation.service.argument.model.Token;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaggingModelServiceTest {

  @Mock private TagSource tagSource;

  private ArgumentationConfig config;
  private TaggingModelService service;

  @BeforeEach
  void setUp() {
    config = new ArgumentationConfig();
    service = new TaggingModelService(tagSource, config);
  }

  @Test
  @DisplayName("Should probe the model only once after it becomes ready")
  void shouldInitializeOnce() {
    when(tagSource.isAvailable()).thenReturn(true);

    assertThat(service.ensureInitialized()).isTrue();
    assertThat(service.ensureInitialized()).isTrue();

    assertThat(service.isReady()).isTrue();
    verify(tagSource, times(1)).isAvailable();
  }

  @Test
  @DisplayName("Should retry initialization while the model is unavailable")
  void shouldRetryWhileNotReady() {
    when(tagSource.isAvailable()).thenReturn(false, true);

    assertThat(service.ensureInitialized()).isFalse();
    assertThat(service.isReady()).isFalse();
    assertThat(service.ensureInitialized()).isTrue();

    verify(tagSource, times(2)).isAvailable();
  }

  @Test
  @DisplayName("Should return an empty result instead of failing when not ready")
  void shouldReturnEmptyWhenNotReady() {
    when(tagSource.isAvailable()).thenReturn(false);

    TaggedText result = service.tag("Un texto cualquiera");

    assertThat(result.isEmpty()).isTrue();
    verify(tagSource, never()).tag("Un texto cualquiera");
  }

  @Test
  @DisplayName("Should delegate to the tag source when ready")
  void shouldDelegateWhenReady() {
    TaggedText tagged = new TaggedText(List.of(Token.of("Hola", "INTJ")), List.of("O"));
    when(tagSource.isAvailable()).thenReturn(true);
    when(tagSource.tag("Hola")).thenReturn(tagged);

    assertThat(service.tag("Hola")).isEqualTo(tagged);
  }

  @Test
  @DisplayName("Should never initialize when tagging is disabled")
  void shouldNotInitializeWhenDisabled() {
    config.getTagging().setEnabled(false);

    assertThat(service.ensureInitialized()).isFalse();
    assertThat(service.tag("Hola").isEmpty()).isTrue();
    verify(tagSource, never()).isAvailable();
  }

  @Test
  @Timeout(10)
  @DisplayName("Should answer immediately while another caller is probing the model")
  void shouldNotWaitForProbeInFlight() throws Exception {
    CountDownLatch probeStarted = new CountDownLatch(1);
    CountDownLatch releaseProbe = new CountDownLatch(1);
    when(tagSource.isAvailable())
        .thenAnswer(
            invocation -> {
              probeStarted.countDown();
              releaseProbe.await(5, TimeUnit.SECONDS);
              return false;
            });

    CompletableFuture<TaggedText> prober = CompletableFuture.supplyAsync(() -> service.tag("x"));
    assertThat(probeStarted.await(5, TimeUnit.SECONDS)).isTrue();

    for (int i = 0; i < 7; i++) {
      assertThat(service.tag("x").isEmpty()).isTrue();
    }
    verify(tagSource, times(1)).isAvailable();

    releaseProbe.countDown();
    assertThat(prober.get(5, TimeUnit.SECONDS).isEmpty()).isTrue();
    assertThat(service.isReady()).isFalse();
  }
}
