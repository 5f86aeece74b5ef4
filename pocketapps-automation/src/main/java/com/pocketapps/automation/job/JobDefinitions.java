package com.pocketapps.automation.job;

import com.pocketapps.automation.action.ActionConfig;
import com.pocketapps.automation.action.ActionConfigs;
import com.pocketapps.automation.action.ActionKind;
import com.pocketapps.automation.cron.CronExpression;
import com.pocketapps.automation.cron.InvalidCronExpressionException;

import java.time.Instant;

/**
 * Turns {@link JobDefinition}s into validated, not yet persisted jobs.
 */
public final class JobDefinitions {

    static final int MAX_NAME_LENGTH = 200;

    private JobDefinitions() {
    }

    /**
     * Validate a definition.
     *
     * @param now reference time for the advisory next run
     * @throws JobValidationException if any rule is broken
     */
    public static Job toJob(long appId, JobDefinition definition, Instant now) {
        if (definition == null) {
            throw new JobValidationException("Job definition is empty");
        }
        String name = definition.name() == null ? "" : definition.name().trim();
        if (name.isEmpty()) {
            throw new JobValidationException("Job name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }

        ActionKind kind = ActionKind.fromWireName(definition.action())
                .orElseThrow(() -> new JobValidationException("Unsupported action '" + definition.action() + "'"));

        CronExpression cron;
        try {
            cron = CronExpression.parse(definition.schedule());
        } catch (InvalidCronExpressionException e) {
            throw new JobValidationException(e.getMessage(), e);
        }

        ActionConfig config = ActionConfigs.parse(kind, definition.config());

        return Job.builder()
                .appId(appId)
                .name(name)
                .schedule(cron.getExpression())
                .humanReadable(definition.humanReadable())
                .config(config)
                .active(true)
                .nextRun(cron.nextRunAfter(now).orElse(null))
                .build();
    }
}
