package com.pocketapps.automation.job;

import com.pocketapps.automation.action.ActionConfig;
import com.pocketapps.automation.action.ActionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A persisted automation job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    private Long id;
    private long appId;
    private String name;
    private String schedule; // 5-field cron, e.g. "0 9 * * *"
    private String humanReadable;
    private ActionConfig config;
    @Builder.Default
    private boolean active = true;

    private volatile Instant lastRun;
    private volatile Instant nextRun; // advisory only

    public ActionKind getAction() {
        return config != null ? config.kind() : null;
    }
}
