package com.pocketapps.app.config;

import com.pocketapps.automation.action.ActionExecutor;
import com.pocketapps.automation.aggregate.Aggregator;
import com.pocketapps.automation.data.DataWriteService;
import com.pocketapps.automation.job.JobScheduler;
import com.pocketapps.automation.job.SchedulerSettings;
import com.pocketapps.automation.store.DataPointStore;
import com.pocketapps.automation.store.JobStore;
import com.pocketapps.automation.store.SqliteDataPointStore;
import com.pocketapps.automation.store.SqliteDatabase;
import com.pocketapps.automation.store.SqliteJobStore;
import com.pocketapps.common.net.FetchSettings;
import com.pocketapps.common.net.SafeFetcher;
import com.pocketapps.common.net.SsrfGuard;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spring configuration for the automation engine beans.
 */
@Configuration
public class AutomationBeanConfig {

    @Value("${pocketapps.db.path:~/.pocketapps/pocketapps.db}")
    private String dbPath;

    @Value("${pocketapps.automation.max-jobs-per-app:5}")
    private int maxJobsPerApp;
    @Value("${pocketapps.automation.worker-threads:4}")
    private int workerThreads;
    @Value("${pocketapps.automation.triggered-wait-ms:15000}")
    private long triggeredWaitMs;

    @Value("${pocketapps.fetch.timeout-ms:10000}")
    private long fetchTimeoutMs;
    @Value("${pocketapps.fetch.max-body-bytes:1048576}")
    private long fetchMaxBodyBytes;
    @Value("${pocketapps.fetch.allow-private-network:false}")
    private boolean allowPrivateNetwork;
    @Value("${pocketapps.fetch.allowed-hostnames:}")
    private String allowedHostnames;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SqliteDatabase sqliteDatabase() {
        String resolvedPath = dbPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new SqliteDatabase(Path.of(resolvedPath));
    }

    @Bean
    public JobStore jobStore(SqliteDatabase database) {
        return new SqliteJobStore(database);
    }

    @Bean
    public DataPointStore dataPointStore(SqliteDatabase database, Clock clock) {
        return new SqliteDataPointStore(database, clock);
    }

    @Bean
    public FetchSettings fetchSettings() {
        Set<String> hostnames = Arrays.stream(allowedHostnames.split(","))
                .map(String::trim)
                .filter(h -> !h.isEmpty())
                .collect(Collectors.toSet());
        return FetchSettings.DEFAULT
                .withTimeout(Duration.ofMillis(fetchTimeoutMs))
                .withMaxBodyBytes(fetchMaxBodyBytes)
                .withPolicy(new SsrfGuard.Policy(allowPrivateNetwork, hostnames));
    }

    @Bean
    public SafeFetcher safeFetcher(FetchSettings fetchSettings) {
        return new SafeFetcher(fetchSettings);
    }

    @Bean
    public Aggregator aggregator(DataPointStore dataPointStore, Clock clock) {
        return new Aggregator(dataPointStore, clock);
    }

    @Bean
    public ActionExecutor actionExecutor(DataPointStore dataPointStore, SafeFetcher safeFetcher,
            Aggregator aggregator, Clock clock) {
        return new ActionExecutor(dataPointStore, safeFetcher, aggregator, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public JobScheduler jobScheduler(JobStore jobStore, ActionExecutor actionExecutor, Clock clock) {
        SchedulerSettings settings = new SchedulerSettings(maxJobsPerApp, workerThreads,
                Duration.ofMillis(triggeredWaitMs));
        return new JobScheduler(jobStore, actionExecutor, settings, clock);
    }

    @Bean
    public DataWriteService dataWriteService(DataPointStore dataPointStore, JobScheduler jobScheduler) {
        return new DataWriteService(dataPointStore, jobScheduler);
    }
}
