package io.b2mash.chatops.slack.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Interactive button or select menu on a legacy attachment. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttachmentAction(
    String name,
    String value,
    String type,
    String text,
    @JsonProperty("selected_options") List<ActionOption> selectedOptions,
    @JsonProperty("option_groups") List<OptionGroup> optionGroups) {

  public static AttachmentAction button(String name, String value, String text) {
    return new AttachmentAction(name, value, "button", text, null, null);
  }

  public static AttachmentAction select(
      String name, String text, List<ActionOption> selected, List<OptionGroup> groups) {
    return new AttachmentAction(name, null, "select", text, selected, groups);
  }
}
