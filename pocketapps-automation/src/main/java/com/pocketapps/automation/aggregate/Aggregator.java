package com.pocketapps.automation.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.store.DataPointStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Computes numeric aggregates over an application's recent data points.
 * <p>
 * A sample is either a bare JSON number or an object carrying the number in
 * a field named after the data key, {@code value} or {@code result} (first
 * present field wins). Anything else is ignored.
 */
@Slf4j
public class Aggregator {

    static final int MIN_WINDOW_DAYS = 1;
    static final int MAX_WINDOW_DAYS = 365;

    private static final String[] FALLBACK_FIELDS = {"value", "result"};

    private final DataPointStore store;
    private final Clock clock;

    public Aggregator(DataPointStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Aggregate {@code dataKey} samples written in the last {@code windowDays}
     * days.
     *
     * @param operation  one of {@code avg, sum, count, max, min}
     * @param windowDays clamped to [1, 365]
     * @return the result, or empty if the operation is unknown or there are
     *         no numeric samples
     */
    public OptionalDouble aggregate(long appId, String dataKey, String operation, int windowDays) {
        Optional<AggregateOperation> op = AggregateOperation.fromName(operation);
        if (op.isEmpty()) {
            log.warn("Unknown aggregate operation '{}' for app {}", operation, appId);
            return OptionalDouble.empty();
        }
        int days = Math.max(MIN_WINDOW_DAYS, Math.min(MAX_WINDOW_DAYS, windowDays));
        Instant since = clock.instant().minus(Duration.ofDays(days));

        List<DataPoint> rows = store.findSince(appId, dataKey, since);
        double[] samples = rows.stream()
                .map(row -> numericValue(row.value(), dataKey))
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .toArray();
        if (samples.length == 0) {
            log.debug("No numeric samples of {} for app {} in the last {} days", dataKey, appId, days);
            return OptionalDouble.empty();
        }
        return op.get().apply(samples);
    }

    static OptionalDouble numericValue(JsonNode value, String dataKey) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (value.isNumber()) {
            return OptionalDouble.of(value.doubleValue());
        }
        if (!value.isObject()) {
            return OptionalDouble.empty();
        }
        JsonNode candidate = present(value.get(dataKey));
        for (int i = 0; candidate == null && i < FALLBACK_FIELDS.length; i++) {
            candidate = present(value.get(FALLBACK_FIELDS[i]));
        }
        if (candidate != null && candidate.isNumber()) {
            return OptionalDouble.of(candidate.doubleValue());
        }
        return OptionalDouble.empty();
    }

    private static JsonNode present(JsonNode node) {
        return node == null || node.isNull() ? null : node;
    }
}
