package com.pocketapps.automation.action;

/**
 * Typed configuration of one action kind. Each implementation checks its own
 * required fields in {@link #validate()}.
 */
public sealed interface ActionConfig
        permits LogEntryConfig, FetchUrlConfig, SendReminderConfig, AggregateDataConfig {

    ActionKind kind();

    /**
     * Data key whose writes run this job immediately, or {@code null}.
     */
    String triggerOnKey();

    /**
     * @throws com.pocketapps.automation.job.JobValidationException if a
     *         required field is missing or malformed
     */
    void validate();
}
