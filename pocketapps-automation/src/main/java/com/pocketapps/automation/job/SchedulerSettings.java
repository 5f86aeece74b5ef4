package com.pocketapps.automation.job;

import java.time.Duration;

/**
 * Scheduler limits.
 *
 * @param maxJobsPerApp        jobs allowed per application
 * @param workerThreads        threads running triggers and handlers
 * @param triggeredWaitBudget  how long a data write waits for the jobs it
 *                             triggers before moving on
 */
public record SchedulerSettings(int maxJobsPerApp, int workerThreads, Duration triggeredWaitBudget) {

    public static final Duration DEFAULT_WAIT_BUDGET = Duration.ofSeconds(15);

    public static final SchedulerSettings DEFAULT = new SchedulerSettings(5, 4, DEFAULT_WAIT_BUDGET);

    public SchedulerSettings {
        if (maxJobsPerApp < 0) {
            throw new IllegalArgumentException("maxJobsPerApp must be >= 0");
        }
        if (workerThreads < 1) {
            workerThreads = 1;
        }
        if (triggeredWaitBudget == null || triggeredWaitBudget.isNegative()) {
            triggeredWaitBudget = DEFAULT_WAIT_BUDGET;
        }
    }
}
