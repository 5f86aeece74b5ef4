package com.pocketapps.automation.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A job as produced by the app-generation side, before validation.
 *
 * @param name          display name
 * @param schedule      5-field cron expression
 * @param humanReadable display-only schedule description
 * @param action        action kind wire name, e.g. {@code fetch_url}
 * @param config        action-specific configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobDefinition(String name, String schedule, String humanReadable, String action, JsonNode config) {
}
