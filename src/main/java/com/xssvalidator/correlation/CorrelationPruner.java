package com.xssvalidator.correlation;

import com.xssvalidator.intruder.AttackId;
import com.xssvalidator.model.ValidatorConfig;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodically drops finished and abandoned attacks from the {@link CorrelationTable}.
 * A completed attack keeps its unmatched payloads for {@code correlation.graceSeconds}
 * so late responses can still be correlated.
 */
public class CorrelationPruner {

    static final long SWEEP_INTERVAL_SECONDS = 30;
    static final long IDLE_TIMEOUT_MILLIS = TimeUnit.MINUTES.toMillis(30);

    private final CorrelationTable table;
    private final ValidatorConfig config;
    private final Object schedulerLock = new Object();
    private ScheduledExecutorService scheduler;
    private volatile Consumer<String> logger;

    public CorrelationPruner(CorrelationTable table, ValidatorConfig config) {
        this.table = table;
        this.config = config;
    }

    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
    }

    public void start() {
        synchronized (schedulerLock) {
            if (scheduler != null) return;
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "XssValidator-Pruner");
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(this::sweepSafe,
                    SWEEP_INTERVAL_SECONDS, SWEEP_INTERVAL_SECONDS, TimeUnit.SECONDS);
        }
    }

    /** Runs one pruning pass. */
    public List<AttackId> sweep() {
        List<AttackId> removed = table.pruneExpired(
                TimeUnit.SECONDS.toMillis(config.getCorrelationGraceSeconds()), IDLE_TIMEOUT_MILLIS);
        if (!removed.isEmpty()) {
            Consumer<String> log = logger;
            if (log != null) {
                log.accept("[Pruner] Dropped unmatched payloads of " + removed.size() + " attack(s): " + removed);
            }
        }
        return removed;
    }

    private void sweepSafe() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // A failed pass must not cancel the schedule
            Consumer<String> log = logger;
            if (log != null) log.accept("[Pruner] Sweep failed: " + e);
        }
    }

    public void shutdown() {
        synchronized (schedulerLock) {
            if (scheduler == null) return;
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }
}
