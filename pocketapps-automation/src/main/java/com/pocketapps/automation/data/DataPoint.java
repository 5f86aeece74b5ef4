package com.pocketapps.automation.data;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One row of an application's append-only key/value log.
 */
public record DataPoint(long id, long appId, String key, JsonNode value, Instant createdAt) {
}
