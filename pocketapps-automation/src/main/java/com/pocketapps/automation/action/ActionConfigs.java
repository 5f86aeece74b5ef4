package com.pocketapps.automation.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.job.JobValidationException;

/**
 * Binds raw JSON action configuration to the typed record of its kind.
 */
public final class ActionConfigs {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ActionConfigs() {
    }

    /**
     * Bind and validate.
     *
     * @param kind action kind
     * @param node raw configuration; {@code null} is treated as {@code {}}
     * @throws JobValidationException if binding or validation fails
     */
    public static ActionConfig parse(ActionKind kind, JsonNode node) {
        JsonNode source = node == null || node.isNull() || node.isMissingNode()
                ? MAPPER.createObjectNode()
                : node;
        if (!source.isObject()) {
            throw new JobValidationException(kind.wireName() + " config must be an object");
        }
        ActionConfig config;
        try {
            config = MAPPER.treeToValue(source, kind.configType());
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Malformed " + kind.wireName() + " config: "
                    + e.getOriginalMessage(), e);
        }
        config.validate();
        return config;
    }

    /**
     * Parse a config previously serialized with {@link #toJson(ActionConfig)}.
     */
    public static ActionConfig parse(ActionKind kind, String json) {
        try {
            return parse(kind, json == null ? null : MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Stored " + kind.wireName() + " config is not JSON", e);
        }
    }

    public static String toJson(ActionConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + config.kind().wireName() + " config", e);
        }
    }

    static void checkTriggerKey(String triggerOnKey) {
        if (triggerOnKey != null && !DataKeys.isValid(triggerOnKey)) {
            throw new JobValidationException("'triggerOnKey' is not a valid data key");
        }
    }
}
