package com.pocketapps.automation.action;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pocketapps.automation.data.DataKeys;
import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.job.Job;
import com.pocketapps.automation.store.DataPointStore;

import java.time.Clock;
import java.util.List;

class SendReminderAction implements ActionHandler<SendReminderConfig> {

    private final DataPointStore store;
    private final Clock clock;

    SendReminderAction(DataPointStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public List<DataPoint> execute(Job job, SendReminderConfig config) {
        ObjectNode reminder = JsonNodeFactory.instance.objectNode();
        reminder.put("text", config.text());
        reminder.put("sentAt", clock.instant().toString());
        String key = DataKeys.resolve(config.outputKey(), job.getId(), "reminder");
        return List.of(store.append(job.getAppId(), key, reminder));
    }
}
