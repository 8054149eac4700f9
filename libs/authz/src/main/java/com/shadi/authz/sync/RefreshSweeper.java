package com.shadi.authz.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically refreshes cached subjects shortly before they go stale, so active users rarely hit
 * a synchronous refresh. Goes through the orchestrator's single-flight path like any other refresh.
 */
public class RefreshSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RefreshSweeper.class);

    private final SyncOrchestrator orchestrator;
    private final PermissionCache cache;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration lead;
    private final Clock clock;

    private ScheduledFuture<?> task;

    /**
     * @param interval how often to sweep
     * @param lead     refresh entries that go stale within this window
     */
    public RefreshSweeper(SyncOrchestrator orchestrator, PermissionCache cache,
                          ScheduledExecutorService scheduler, Duration interval, Duration lead, Clock clock) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.orchestrator = orchestrator;
        this.cache = cache;
        this.scheduler = scheduler;
        this.interval = interval;
        this.lead = lead;
        this.clock = clock;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::sweepSafely,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Permission refresh sweep every {} with lead {}", interval, lead);
    }

    /**
     * Starts background refreshes for every entry nearing expiry.
     *
     * @return how many refreshes were requested
     */
    public int sweep() {
        List<String> due = cache.subjectsNearingExpiry(clock.instant(), lead);
        for (String subjectId : due) {
            orchestrator.refreshInBackground(subjectId);
        }
        if (!due.isEmpty()) {
            log.debug("Requested background refresh for {} subjects", due.size());
        }
        return due.size();
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task
            log.error("Permission refresh sweep failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }
}
