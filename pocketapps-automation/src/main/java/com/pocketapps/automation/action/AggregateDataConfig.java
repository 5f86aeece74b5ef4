package com.pocketapps.automation.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.job.JobValidationException;

/**
 * {@code aggregate_data}: computes {@code operation} over {@code dataKey}
 * samples from the last {@code windowDays} days and stores the number under
 * {@code outputKey}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregateDataConfig(String dataKey, String operation, String outputKey, Integer windowDays,
        String triggerOnKey) implements ActionConfig {

    public static final int DEFAULT_WINDOW_DAYS = 7;

    public AggregateDataConfig {
        if (windowDays == null) {
            windowDays = DEFAULT_WINDOW_DAYS;
        }
    }

    @Override
    public ActionKind kind() {
        return ActionKind.AGGREGATE_DATA;
    }

    @Override
    public void validate() {
        if (!DataKeys.isValid(dataKey)) {
            throw new JobValidationException("aggregate_data requires a valid 'dataKey'");
        }
        if (operation == null || operation.isBlank()) {
            throw new JobValidationException("aggregate_data requires 'operation'");
        }
        if (outputKey == null || outputKey.isBlank()) {
            throw new JobValidationException("aggregate_data requires 'outputKey'");
        }
        ActionConfigs.checkTriggerKey(triggerOnKey);
    }
}
