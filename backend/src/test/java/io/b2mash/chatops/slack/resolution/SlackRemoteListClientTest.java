package io.b2mash.chatops.slack.resolution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.chatops.slack.client.SlackApiClient;
import io.b2mash.chatops.slack.client.SlackApiException;
import io.b2mash.chatops.slack.client.SlackCredentials;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SlackRemoteListClientTest {

  private static final SlackCredentials CREDENTIALS = new SlackCredentials("xoxb-test");

  @Mock private SlackApiClient slackApiClient;

  @InjectMocks private SlackRemoteListClient listClient;

  @Test
  @SuppressWarnings("unchecked")
  void first_page_sends_listing_params_without_cursor() {
    when(slackApiClient.get(eq("/conversations.list"), anyMap(), anyMap()))
        .thenReturn(
            Map.of(
                "ok", true,
                "channels", List.of(Map.of("id", "C123", "name", "general")),
                "response_metadata", Map.of("next_cursor", "dGVhbTpD")));

    var page = listClient.fetch(CREDENTIALS, ListType.CONVERSATIONS, "", 1000);

    assertThat(page.items()).containsExactly(new ListItem("C123", "general", null));
    assertThat(page.nextCursor()).isEqualTo("dGVhbTpD");
    assertThat(page.hasMore()).isTrue();

    ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
    ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
    verify(slackApiClient).get(eq("/conversations.list"), headers.capture(), params.capture());
    assertThat(headers.getValue()).containsEntry("Authorization", "Bearer xoxb-test");
    assertThat(params.getValue())
        .containsEntry("exclude_archived", false)
        .containsEntry("exclude_members", true)
        .containsEntry("types", "public_channel,private_channel")
        .containsEntry("limit", 1000)
        .doesNotContainKey("cursor");
  }

  @Test
  @SuppressWarnings("unchecked")
  void user_page_reads_display_name_and_sends_cursor() {
    when(slackApiClient.get(eq("/users.list"), anyMap(), anyMap()))
        .thenReturn(
            Map.of(
                "ok",
                true,
                "members",
                List.of(
                    Map.of("id", "U1", "name", "jdoe", "profile", Map.of("display_name", "Jane")),
                    Map.of("id", "U2", "name", "bot"))));

    var page = listClient.fetch(CREDENTIALS, ListType.USERS, "abc", 200);

    assertThat(page.items())
        .containsExactly(new ListItem("U1", "jdoe", "Jane"), new ListItem("U2", "bot", null));
    assertThat(page.hasMore()).isFalse();

    ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
    verify(slackApiClient).get(eq("/users.list"), anyMap(), params.capture());
    assertThat(params.getValue()).containsEntry("cursor", "abc").containsEntry("limit", 200);
  }

  @Test
  void slack_errors_propagate() {
    when(slackApiClient.get(any(), anyMap(), anyMap()))
        .thenThrow(new SlackApiException(429, "ratelimited"));

    assertThatThrownBy(() -> listClient.fetch(CREDENTIALS, ListType.USERS, "", 1000))
        .isInstanceOf(SlackApiException.class)
        .hasMessageContaining("ratelimited");
  }
}
