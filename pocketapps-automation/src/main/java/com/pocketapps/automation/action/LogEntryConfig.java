package com.pocketapps.automation.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.job.JobValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code log_entry}: writes an empty entry skeleton with one stub per declared
 * field. Field types are {@code "number"} or anything else (treated as text).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntryConfig(Map<String, String> fields, String outputKey, String triggerOnKey)
        implements ActionConfig {

    public LogEntryConfig {
        fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
    }

    @Override
    public ActionKind kind() {
        return ActionKind.LOG_ENTRY;
    }

    @Override
    public void validate() {
        ActionConfigs.checkTriggerKey(triggerOnKey);
        for (String field : fields.keySet()) {
            if (!DataKeys.isValid(field)) {
                throw new JobValidationException("log_entry field name '" + field + "' is not a valid identifier");
            }
        }
    }
}
