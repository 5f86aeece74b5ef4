package com.pocketapps.app.config;

import com.pocketapps.automation.job.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Re-registers persisted jobs once the application is up. Triggers are not
 * persisted, so every start rebuilds them from the active job rows.
 */
@Slf4j
@Component
public class AutomationBootstrap {

    private final JobScheduler jobScheduler;

    public AutomationBootstrap(JobScheduler jobScheduler) {
        this.jobScheduler = jobScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            int scheduled = jobScheduler.loadAll();
            log.info("Automation engine ready ({} jobs scheduled)", scheduled);
        } catch (Exception e) {
            log.error("Failed to load automation jobs: {}", e.getMessage(), e);
        }
    }
}
