package com.pocketapps.automation.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketapps.automation.job.JobScheduler;
import com.pocketapps.automation.store.DataPointStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Entry point for user-initiated data writes: validates, appends, then runs
 * the jobs watching the written key.
 */
@Slf4j
public class DataWriteService {

    public static final int MAX_VALUE_BYTES = 10_000;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataPointStore store;
    private final JobScheduler scheduler;

    public DataWriteService(DataPointStore store, JobScheduler scheduler) {
        this.store = store;
        this.scheduler = scheduler;
    }

    /**
     * Append a value and wait, up to the scheduler's budget, for triggered
     * jobs. Jobs still running past the budget finish in the background.
     *
     * @throws IllegalArgumentException if the key or value is rejected
     */
    public DataPoint write(long appId, String key, JsonNode value) {
        if (!DataKeys.isValid(key)) {
            throw new IllegalArgumentException("Invalid data key: must match " + DataKeys.KEY_PATTERN.pattern());
        }
        if (value == null || value.isMissingNode()) {
            throw new IllegalArgumentException("Value is required");
        }
        int size = serializedSize(value);
        if (size > MAX_VALUE_BYTES) {
            throw new IllegalArgumentException("Value too large: " + size + " bytes (max " + MAX_VALUE_BYTES + ")");
        }

        DataPoint point = store.append(appId, key, value);
        if (!scheduler.runTriggeredJobs(appId, key, scheduler.triggeredWaitBudget())) {
            log.info("App {}: responding before triggered jobs for {} finished", appId, key);
        }
        return point;
    }

    private static int serializedSize(JsonNode value) {
        try {
            return MAPPER.writeValueAsString(value).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable", e);
        }
    }
}
