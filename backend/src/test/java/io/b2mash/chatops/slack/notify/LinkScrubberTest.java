package io.b2mash.chatops.slack.notify;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LinkScrubberTest {

  @Test
  void scrubs_organization_issue_and_event_ids() {
    assertThat(
            LinkScrubber.parseLink(
                "https://errors.test/organizations/acme/issues/42/events/abc123/"))
        .isEqualTo("organizations/{organization}/issues/{issue_id}/events/{event_id}/");
  }

  @Test
  void scrubs_project_query_param_and_keeps_others() {
    assertThat(
            LinkScrubber.parseLink(
                "https://errors.test/organizations/acme/issues/42/?referrer=slack&project=7"))
        .isEqualTo(
            "organizations/{organization}/issues/{issue_id}/referrer=slack&project=%7Bproject%7D");
  }

  @Test
  void other_segments_are_untouched() {
    assertThat(LinkScrubber.parseLink("https://errors.test/settings/account/"))
        .isEqualTo("settings/account/");
  }

  @Test
  void trailing_keyword_without_id_is_kept() {
    assertThat(LinkScrubber.parseLink("https://errors.test/organizations/"))
        .isEqualTo("organizations/");
  }
}
