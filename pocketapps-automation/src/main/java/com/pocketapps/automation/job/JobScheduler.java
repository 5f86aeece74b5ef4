package com.pocketapps.automation.job;

import com.pocketapps.automation.action.ActionExecutor;
import com.pocketapps.automation.cron.CronExpression;
import com.pocketapps.automation.cron.InvalidCronExpressionException;
import com.pocketapps.automation.data.DataPoint;
import com.pocketapps.automation.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns one live trigger per active job: validates and persists new jobs,
 * re-registers persisted ones at startup, and runs them on their cron
 * schedule or when a watched data key is written.
 * <p>
 * A failing action is logged and never cancels its trigger or touches other
 * jobs. Runs of the same job never overlap; a firing that finds the previous
 * run still busy is skipped.
 */
@Slf4j
public class JobScheduler implements AutoCloseable {

    private final JobStore jobStore;
    private final ActionExecutor actionExecutor;
    private final SchedulerSettings settings;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final Map<Long, Trigger> triggers = new ConcurrentHashMap<>();
    private final Set<Long> running = ConcurrentHashMap.newKeySet();

    public JobScheduler(JobStore jobStore, ActionExecutor actionExecutor, SchedulerSettings settings, Clock clock) {
        this.jobStore = jobStore;
        this.actionExecutor = actionExecutor;
        this.settings = settings != null ? settings : SchedulerSettings.DEFAULT;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(this.settings.workerThreads(), r -> {
            Thread t = new Thread(r, "automation-worker");
            t.setDaemon(true);
            return t;
        });
    }

    // --- Registration ---

    /**
     * Register a trigger for every active persisted job. Called once at
     * startup.
     *
     * @return number of jobs scheduled
     */
    public int loadAll() {
        List<Job> active = jobStore.findActive();
        int scheduled = 0;
        for (Job job : active) {
            if (schedule(job)) {
                scheduled++;
            }
        }
        log.info("Loaded {} active automation jobs", scheduled);
        return scheduled;
    }

    /**
     * Validate, persist and schedule a batch of definitions for one app.
     * <p>
     * Invalid definitions are logged and skipped without affecting the rest.
     * Once the app holds {@link SchedulerSettings#maxJobsPerApp()} jobs the
     * remaining definitions are dropped.
     *
     * @return the jobs created, in input order
     * @throws com.pocketapps.automation.store.StoreException if persisting fails
     */
    public synchronized List<Job> addJobs(long appId, List<JobDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            return List.of();
        }
        int slots = Math.max(0, settings.maxJobsPerApp() - jobStore.countByApp(appId));
        Instant now = clock.instant();
        List<Job> created = new ArrayList<>();

        for (int i = 0; i < definitions.size(); i++) {
            if (created.size() >= slots) {
                log.warn("App {} reached the limit of {} jobs, dropping {} remaining definition(s)",
                        appId, settings.maxJobsPerApp(), definitions.size() - i);
                break;
            }
            JobDefinition definition = definitions.get(i);
            Job job;
            try {
                job = JobDefinitions.toJob(appId, definition, now);
            } catch (JobValidationException e) {
                log.warn("App {}: rejected job definition '{}': {}",
                        appId, definition != null ? definition.name() : null, e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.error("App {}: could not validate job definition '{}': {}",
                        appId, definition != null ? definition.name() : null, e.getMessage(), e);
                continue;
            }
            Job saved = jobStore.insert(job);
            schedule(saved);
            created.add(saved);
            log.info("App {}: added job {} '{}' ({}, {})", appId, saved.getId(), saved.getName(),
                    saved.getSchedule(), saved.getAction().wireName());
        }
        return created;
    }

    /**
     * Administratively stop a job. It stays in the store but is never
     * scheduled again, including after a restart.
     *
     * @return {@code false} if no such job exists
     */
    public boolean deactivate(long jobId) {
        if (jobStore.findById(jobId).isEmpty()) {
            return false;
        }
        jobStore.setActive(jobId, false);
        cancel(jobId);
        log.info("Deactivated job {}", jobId);
        return true;
    }

    /**
     * Ids of the jobs that currently hold a trigger.
     */
    public Set<Long> scheduledJobIds() {
        return new TreeSet<>(triggers.keySet());
    }

    private boolean schedule(Job job) {
        if (!job.isActive()) {
            return false;
        }
        CronExpression cron;
        try {
            cron = CronExpression.parse(job.getSchedule());
        } catch (InvalidCronExpressionException e) {
            log.warn("Not scheduling job {}: {}", job.getId(), e.getMessage());
            return false;
        }
        Trigger trigger = new Trigger(job, cron);
        Trigger previous = triggers.put(job.getId(), trigger);
        if (previous != null) {
            previous.cancel();
        }
        arm(trigger, clock.instant());
        return true;
    }

    private void cancel(long jobId) {
        Trigger trigger = triggers.remove(jobId);
        if (trigger != null) {
            trigger.cancel();
        }
    }

    // --- Triggering ---

    private void arm(Trigger trigger, Instant after) {
        if (scheduler.isShutdown() || triggers.get(trigger.job.getId()) != trigger) {
            return;
        }
        Optional<Instant> next = trigger.cron.nextRunAfter(after);
        if (next.isEmpty()) {
            // nothing inside the search window; look again from its end
            Instant horizonEnd = after.plus(CronExpression.SEARCH_HORIZON);
            log.info("Job {} has no run before {}, checking again then", trigger.job.getId(), horizonEnd);
            trigger.future = scheduler.schedule(() -> arm(trigger, horizonEnd),
                    delayUntil(horizonEnd), TimeUnit.NANOSECONDS);
            return;
        }
        Instant fireAt = next.get();
        trigger.scheduledFor = fireAt;
        trigger.future = scheduler.schedule(() -> onTrigger(trigger, fireAt),
                delayUntil(fireAt), TimeUnit.NANOSECONDS);
        if (triggers.get(trigger.job.getId()) != trigger) {
            trigger.cancel(); // cancelled while arming
            return;
        }
        log.debug("Job {} next run at {}", trigger.job.getId(), fireAt);
    }

    private void onTrigger(Trigger trigger, Instant scheduledFor) {
        try {
            runGuarded(trigger.job);
        } catch (Exception e) {
            log.error("Job {} run failed: {}", trigger.job.getId(), e.getMessage(), e);
        } finally {
            Instant now = clock.instant();
            arm(trigger, now.isAfter(scheduledFor) ? now : scheduledFor);
        }
    }

    /**
     * Fire a scheduled job now, as its trigger would.
     *
     * @return {@code false} if the job has no trigger or is already running
     */
    boolean fire(long jobId) {
        Trigger trigger = triggers.get(jobId);
        return trigger != null && runGuarded(trigger.job);
    }

    Optional<Instant> nextFireTime(long jobId) {
        Trigger trigger = triggers.get(jobId);
        return trigger == null ? Optional.empty() : Optional.ofNullable(trigger.scheduledFor);
    }

    private boolean runGuarded(Job job) {
        if (!running.add(job.getId())) {
            log.info("Job {} is still running, skipping this run", job.getId());
            return false;
        }
        try {
            runJob(job);
            return true;
        } finally {
            running.remove(job.getId());
        }
    }

    /**
     * Execute the job's action, then record the run. The run is recorded
     * whether or not the action succeeded.
     *
     * @throws com.pocketapps.automation.store.StoreException if recording fails
     */
    public void runJob(Job job) {
        Instant started = clock.instant();
        try {
            List<DataPoint> written = actionExecutor.execute(job);
            log.debug("Job {} wrote {} data point(s)", job.getId(), written.size());
        } catch (Exception e) {
            log.error("Job {} '{}' failed: {}", job.getId(), job.getName(), e.getMessage(), e);
        }

        Instant lastRun = clock.instant();
        Instant nextRun = nextRunOf(job, lastRun);
        job.setLastRun(lastRun);
        job.setNextRun(nextRun);
        jobStore.recordRun(job.getId(), lastRun, nextRun);
        log.debug("Job {} finished in {}ms", job.getId(), Duration.between(started, lastRun).toMillis());
    }

    private static Instant nextRunOf(Job job, Instant after) {
        try {
            return CronExpression.parse(job.getSchedule()).nextRunAfter(after).orElse(null);
        } catch (InvalidCronExpressionException e) {
            return null;
        }
    }

    /**
     * Run, in the background, every active job of the app whose
     * {@code triggerOnKey} is {@code writtenKey}.
     *
     * @return completes when all of them have finished; never completes
     *         exceptionally because of a job failure
     */
    public CompletableFuture<Void> runTriggeredJobs(long appId, String writtenKey) {
        if (writtenKey == null || scheduler.isShutdown()) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<Void>> runs = new ArrayList<>();
        for (Job job : jobStore.findActiveByApp(appId)) {
            if (job.getConfig() == null || !writtenKey.equals(job.getConfig().triggerOnKey())) {
                continue;
            }
            log.info("App {}: key {} written, running job {}", appId, writtenKey, job.getId());
            runs.add(CompletableFuture.runAsync(() -> runGuarded(job), scheduler)
                    .exceptionally(e -> {
                        log.error("Triggered job {} failed: {}", job.getId(), e.getMessage(), e);
                        return null;
                    }));
        }
        return CompletableFuture.allOf(runs.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Like {@link #runTriggeredJobs(long, String)}, waiting at most
     * {@code waitBudget}. Jobs still running at the deadline carry on in the
     * background.
     *
     * @return {@code true} if every triggered job finished within the budget
     */
    public boolean runTriggeredJobs(long appId, String writtenKey, Duration waitBudget) {
        CompletableFuture<Void> all = runTriggeredJobs(appId, writtenKey);
        try {
            all.get(waitBudget.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("App {}: triggered jobs for key {} still running after {}ms, not waiting",
                    appId, writtenKey, waitBudget.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("App {}: triggered jobs for key {} failed: {}", appId, writtenKey, e.getMessage());
            return true;
        }
    }

    /**
     * The wait budget configured for data writes.
     */
    public Duration triggeredWaitBudget() {
        return settings.triggeredWaitBudget();
    }

    /**
     * Nanoseconds from now until {@code target}, never rounded down, so a
     * trigger cannot fire ahead of its minute.
     */
    long delayUntil(Instant target) {
        return Math.max(0, Duration.between(clock.instant(), target).toNanos());
    }

    // --- Lifecycle ---

    /**
     * Cancel all triggers and stop the worker threads.
     */
    public void shutdown() {
        for (Long jobId : new ArrayList<>(triggers.keySet())) {
            cancel(jobId);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Job scheduler stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private static final class Trigger {
        private final Job job;
        private final CronExpression cron;
        private volatile ScheduledFuture<?> future;
        private volatile Instant scheduledFor;

        private Trigger(Job job, CronExpression cron) {
            this.job = job;
            this.cron = cron;
        }

        private void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
