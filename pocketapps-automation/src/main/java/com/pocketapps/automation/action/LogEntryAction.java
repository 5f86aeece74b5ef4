package com.pocketapps.automation.action;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.job.Job;
import com.pocketapps.automation.store.DataPointStore;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Writes an entry skeleton the user fills in later.
 */
class LogEntryAction implements ActionHandler<LogEntryConfig> {

    static final String NUMBER_TYPE = "number";

    private final DataPointStore store;
    private final Clock clock;

    LogEntryAction(DataPointStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public List<DataPoint> execute(Job job, LogEntryConfig config) {
        ObjectNode entry = JsonNodeFactory.instance.objectNode();
        entry.put("timestamp", clock.instant().toString());
        for (Map.Entry<String, String> field : config.fields().entrySet()) {
            if (NUMBER_TYPE.equalsIgnoreCase(field.getValue())) {
                entry.put(field.getKey(), 0);
            } else {
                entry.put(field.getKey(), "");
            }
        }
        String key = DataKeys.resolve(config.outputKey(), job.getId(), "log");
        return List.of(store.append(job.getAppId(), key, entry));
    }
}
