package com.pocketapps.automation.action;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * What a job does when it fires.
 */
public enum ActionKind {
    LOG_ENTRY("log_entry", LogEntryConfig.class),
    FETCH_URL("fetch_url", FetchUrlConfig.class),
    SEND_REMINDER("send_reminder", SendReminderConfig.class),
    AGGREGATE_DATA("aggregate_data", AggregateDataConfig.class);

    private final String wireName;
    private final Class<? extends ActionConfig> configType;

    ActionKind(String wireName, Class<? extends ActionConfig> configType) {
        this.wireName = wireName;
        this.configType = configType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    Class<? extends ActionConfig> configType() {
        return configType;
    }

    public static Optional<ActionKind> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(normalized))
                .findFirst();
    }
}
