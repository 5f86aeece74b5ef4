package com.pocketapps.automation.store;

import com.pocketapps.automation.job.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for automation jobs.
 */
public interface JobStore {

    /**
     * Insert a new job.
     *
     * @return the job with its generated id
     */
    Job insert(Job job);

    Optional<Job> findById(long id);

    List<Job> findActive();

    List<Job> findActiveByApp(long appId);

    /**
     * Count every job of the application, active or not.
     */
    int countByApp(long appId);

    void recordRun(long jobId, Instant lastRun, Instant nextRun);

    void setActive(long jobId, boolean active);
}
