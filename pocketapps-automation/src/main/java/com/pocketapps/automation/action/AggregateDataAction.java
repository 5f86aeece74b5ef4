package com.pocketapps.automation.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.pocketapps.automation.aggregate.Aggregator;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.job.Job;
import com.pocketapps.automation.store.DataPointStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Stores an {@link Aggregator} result as a plain number. Nothing is written
 * when the aggregate is empty.
 */
@Slf4j
class AggregateDataAction implements ActionHandler<AggregateDataConfig> {

    private final DataPointStore store;
    private final Aggregator aggregator;

    AggregateDataAction(DataPointStore store, Aggregator aggregator) {
        this.store = store;
        this.aggregator = aggregator;
    }

    @Override
    public List<DataPoint> execute(Job job, AggregateDataConfig config) {
        OptionalDouble result = aggregator.aggregate(job.getAppId(), config.dataKey(), config.operation(),
                config.windowDays());
        if (result.isEmpty()) {
            log.info("Job {}: no {} of {} to store", job.getId(), config.operation(), config.dataKey());
            return List.of();
        }
        String key = DataKeys.resolve(config.outputKey(), job.getId(), "aggregate");
        return List.of(store.append(job.getAppId(), key, toNumberNode(result.getAsDouble())));
    }

    static JsonNode toNumberNode(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
            return LongNode.valueOf((long) value);
        }
        return DoubleNode.valueOf(value);
    }
}
