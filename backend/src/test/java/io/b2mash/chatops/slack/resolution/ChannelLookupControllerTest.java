package io.b2mash.chatops.slack.resolution;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.chatops.exception.DuplicateDisplayNameException;
import io.b2mash.chatops.exception.GlobalExceptionHandler;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ChannelLookupControllerTest {

  private static final UUID ORG_ID = UUID.fromString("6f1c2b9e-1a2b-4c3d-8e9f-001122334455");
  private static final UUID INTEGRATION_ID =
      UUID.fromString("0b7e8d6c-5a4b-4c3d-9e8f-665544332211");
  private static final String LOOKUP_URL =
      "/api/organizations/" + ORG_ID + "/integrations/" + INTEGRATION_ID + "/slack/channel-lookups";

  @Mock private ChannelIdService channelIdService;
  @Mock private AsyncChannelLookupService asyncLookupService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ChannelLookupController(channelIdService, asyncLookupService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void resolved_channel_returns_200() throws Exception {
    when(channelIdService.resolveChannelId(ORG_ID, INTEGRATION_ID, "#general", false))
        .thenReturn(new ChannelLookup("#", "C123", false));

    mockMvc
        .perform(
            post(LOOKUP_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"#general\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SUCCESS"))
        .andExpect(jsonPath("$.prefix").value("#"))
        .andExpect(jsonPath("$.channelId").value("C123"));
    verifyNoInteractions(asyncLookupService);
  }

  @Test
  void timed_out_lookup_is_queued_and_returns_202() throws Exception {
    var lookupId = UUID.randomUUID();
    when(channelIdService.resolveChannelId(ORG_ID, INTEGRATION_ID, "#huge", false))
        .thenReturn(new ChannelLookup("#", null, true));
    when(asyncLookupService.enqueue(ORG_ID, INTEGRATION_ID, "#huge")).thenReturn(lookupId);

    mockMvc
        .perform(
            post(LOOKUP_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"#huge\"}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.lookupId").value(lookupId.toString()));
    verify(asyncLookupService).enqueue(ORG_ID, INTEGRATION_ID, "#huge");
  }

  @Test
  void unknown_channel_returns_404() throws Exception {
    when(channelIdService.resolveChannelId(ORG_ID, INTEGRATION_ID, "#nope", false))
        .thenReturn(new ChannelLookup("@", null, false));

    mockMvc
        .perform(
            post(LOOKUP_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"#nope\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Channel not found"));
  }

  @Test
  void ambiguous_display_name_returns_400() throws Exception {
    when(channelIdService.resolveChannelId(ORG_ID, INTEGRATION_ID, "Jane Doe", false))
        .thenThrow(new DuplicateDisplayNameException("Jane Doe"));

    mockMvc
        .perform(
            post(LOOKUP_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Jane Doe\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Ambiguous display name"));
  }

  @Test
  void blank_name_is_rejected() throws Exception {
    mockMvc
        .perform(
            post(LOOKUP_URL).contentType(MediaType.APPLICATION_JSON).content("{\"name\": \"\"}"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(channelIdService);
  }

  @Test
  void polling_returns_current_status() throws Exception {
    var lookupId = UUID.randomUUID();
    when(asyncLookupService.getStatus(lookupId))
        .thenReturn(
            Optional.of(
                new ChannelLookupStatus(
                    lookupId, ChannelLookupStatus.State.SUCCESS, "#", "C9", null)));

    mockMvc
        .perform(get("/api/slack/channel-lookups/" + lookupId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SUCCESS"))
        .andExpect(jsonPath("$.channelId").value("C9"));
  }

  @Test
  void polling_unknown_lookup_returns_404() throws Exception {
    var lookupId = UUID.randomUUID();
    when(asyncLookupService.getStatus(lookupId)).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/slack/channel-lookups/" + lookupId))
        .andExpect(status().isNotFound());
  }
}
