package io.b2mash.chatops.slack.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Legacy Slack message attachment as posted in the {@code attachments} field. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlackAttachment(
    String fallback,
    String title,
    @JsonProperty("title_link") String titleLink,
    String text,
    List<AttachmentField> fields,
    @JsonProperty("mrkdwn_in") List<String> mrkdwnIn,
    @JsonProperty("callback_id") String callbackId,
    @JsonProperty("footer_icon") String footerIcon,
    String footer,
    Long ts,
    String color,
    List<AttachmentAction> actions) {}
