package com.pocketapps.automation.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code send_reminder}: stores {@code {text, sentAt}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendReminderConfig(String text, String outputKey, String triggerOnKey) implements ActionConfig {

    public static final String DEFAULT_TEXT = "Reminder";

    public SendReminderConfig {
        if (text == null || text.isBlank()) {
            text = DEFAULT_TEXT;
        }
    }

    @Override
    public ActionKind kind() {
        return ActionKind.SEND_REMINDER;
    }

    @Override
    public void validate() {
        ActionConfigs.checkTriggerKey(triggerOnKey);
    }
}
