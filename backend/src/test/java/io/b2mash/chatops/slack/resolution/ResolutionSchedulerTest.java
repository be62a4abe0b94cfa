package io.b2mash.chatops.slack.resolution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.chatops.config.SlackProperties;
import io.b2mash.chatops.slack.client.SlackCredentials;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResolutionSchedulerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final SlackCredentials CREDENTIALS = new SlackCredentials("xoxb-test");

  @Mock private NameResolver nameResolver;

  private ResolutionScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler =
        new ResolutionScheduler(
            nameResolver, Clock.fixed(NOW, ZoneOffset.UTC), SlackProperties.defaults());
  }

  @Test
  void inline_lookup_gets_ten_second_budget() {
    when(nameResolver.resolve(any())).thenReturn(ResolutionResult.found("#", "C1"));

    scheduler.resolveChannel("#general", CREDENTIALS, false);

    var captor = ArgumentCaptor.forClass(ResolutionQuery.class);
    verify(nameResolver).resolve(captor.capture());
    assertThat(captor.getValue().deadline()).isEqualTo(NOW.plusSeconds(10));
    assertThat(captor.getValue().name()).isEqualTo("general");
    assertThat(captor.getValue().credentials()).isEqualTo(CREDENTIALS);
  }

  @Test
  void background_lookup_gets_three_minute_budget() {
    when(nameResolver.resolve(any())).thenReturn(ResolutionResult.timedOut("@"));

    var result = scheduler.resolveChannel("@jane", CREDENTIALS, true);

    var captor = ArgumentCaptor.forClass(ResolutionQuery.class);
    verify(nameResolver).resolve(captor.capture());
    assertThat(captor.getValue().deadline()).isEqualTo(NOW.plusSeconds(180));
    assertThat(result.isTimedOut()).isTrue();
  }

  @Test
  void strips_all_leading_prefix_characters() {
    assertThat(ResolutionScheduler.stripChannelName("##@general")).isEqualTo("general");
    assertThat(ResolutionScheduler.stripChannelName("team#ops")).isEqualTo("team#ops");
    assertThat(ResolutionScheduler.stripChannelName("#")).isEmpty();
  }
}
