package in.papersim.service.execution;

import in.papersim.service.trade.LifecycleReconciler;
import in.papersim.service.trade.ReconcilePassSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a reconciliation pass at a fixed delay.
 *
 * Skips a tick while another pass (for example one triggered over HTTP) is still running.
 */
public final class ReconcilerScheduler {
    private static final Logger log = LoggerFactory.getLogger(ReconcilerScheduler.class);

    private final LifecycleReconciler reconciler;
    private final Duration interval;
    private final Duration initialDelay;
    private final ScheduledExecutorService scheduler;

    // Stats
    private volatile long totalPasses = 0;
    private volatile long skippedPasses = 0;
    private volatile long failedPasses = 0;

    public ReconcilerScheduler(LifecycleReconciler reconciler, Duration interval) {
        this(reconciler, interval, Duration.ofSeconds(10));
    }

    public ReconcilerScheduler(LifecycleReconciler reconciler, Duration interval, Duration initialDelay) {
        this.reconciler = reconciler;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
            r -> new Thread(r, "reconciler-scheduler")
        );
    }

    /**
     * Start the scheduled job. A zero or negative interval leaves the scheduler idle.
     */
    public void start() {
        if (interval.isZero() || interval.isNegative()) {
            log.info("[Scheduler] Scheduled reconciliation disabled (interval={}s)", interval.toSeconds());
            return;
        }

        scheduler.scheduleWithFixedDelay(
            this::tick,
            initialDelay.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.info("[Scheduler] Reconciliation scheduled: interval={}s, initialDelay={}s",
            interval.toSeconds(), initialDelay.toSeconds());
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Scheduler] Stopped (passes={}, skipped={}, failed={})", totalPasses, skippedPasses, failedPasses);
    }

    void tick() {
        // An exception escaping a scheduled task cancels every later run
        try {
            Optional<ReconcilePassSummary> summary = reconciler.tryRunPass();
            if (summary.isEmpty()) {
                skippedPasses++;
                log.info("[Scheduler] Previous pass still running, tick skipped");
                return;
            }
            totalPasses++;
        } catch (Exception e) {
            failedPasses++;
            log.error("[Scheduler] Reconciliation pass failed: {}", e.getMessage(), e);
        }
    }

    public long getTotalPasses() {
        return totalPasses;
    }

    public long getSkippedPasses() {
        return skippedPasses;
    }

    public long getFailedPasses() {
        return failedPasses;
    }
}
