package com.pocketapps.automation.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketapps.automation.data.DataPoint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The shared, append-only per-application data log.
 */
public interface DataPointStore {

    DataPoint append(long appId, String key, JsonNode value);

    /**
     * Rows for {@code (appId, key)} created at or after {@code since}, newest
     * first.
     */
    List<DataPoint> findSince(long appId, String key, Instant since);

    Optional<DataPoint> findLatest(long appId, String key);
}
