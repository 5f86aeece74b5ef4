package com.pocketapps.automation.action;

import com.pocketapps.automation.aggregate.Aggregator;
import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.job.Job;
import com.pocketapps.automation.store.DataPointStore;
import com.pocketapps.common.net.UrlFetcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Dispatches a job to the handler for its action kind.
 */
@Slf4j
public class ActionExecutor {

    private final LogEntryAction logEntry;
    private final FetchUrlAction fetchUrl;
    private final SendReminderAction sendReminder;
    private final AggregateDataAction aggregateData;

    public ActionExecutor(DataPointStore store, UrlFetcher fetcher, Aggregator aggregator, Clock clock) {
        this.logEntry = new LogEntryAction(store, clock);
        this.fetchUrl = new FetchUrlAction(store, fetcher, clock);
        this.sendReminder = new SendReminderAction(store, clock);
        this.aggregateData = new AggregateDataAction(store, aggregator);
    }

    /**
     * Run the job's action.
     *
     * @return the data points written
     */
    public List<DataPoint> execute(Job job) {
        ActionConfig config = job.getConfig();
        if (config == null) {
            log.warn("Job {} has no action config, nothing to do", job.getId());
            return List.of();
        }
        log.info("Running job {} '{}' (action: {})", job.getId(), job.getName(), config.kind().wireName());
        return switch (config.kind()) {
            case LOG_ENTRY -> logEntry.execute(job, (LogEntryConfig) config);
            case FETCH_URL -> fetchUrl.execute(job, (FetchUrlConfig) config);
            case SEND_REMINDER -> sendReminder.execute(job, (SendReminderConfig) config);
            case AGGREGATE_DATA -> aggregateData.execute(job, (AggregateDataConfig) config);
        };
    }
}
