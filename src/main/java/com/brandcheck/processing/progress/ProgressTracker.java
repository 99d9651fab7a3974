package com.brandcheck.processing.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks completed, cached and failed units of a batch and derives throughput and ETA on demand.
 * Counters only ever grow. Updates may arrive from any number of worker threads.
 * Progress lines are logged at most once per {@code logIntervalMs}.
 */
public class ProgressTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    private final int total;
    private final long logIntervalMs;
    private final Clock clock;

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger cached = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicLong lastLogMillis = new AtomicLong();
    private volatile long startMillis = -1;
    private volatile long endMillis = -1;

    public ProgressTracker(int total, long logIntervalMs) {
        this(total, logIntervalMs, Clock.systemUTC());
    }

    public ProgressTracker(int total, long logIntervalMs, Clock clock) {
        this.total = Math.max(0, total);
        this.logIntervalMs = logIntervalMs;
        this.clock = clock;
    }

    public void start() {
        startMillis = clock.millis();
        logger.info("Progress: 0/{} units queued", total);
    }

    /**
     * Records {@code completedCount} finished units.
     */
    public void update(int completedCount, String label, boolean fromCache) {
        if (completedCount <= 0) {
            return;
        }
        completed.addAndGet(completedCount);
        if (fromCache) {
            cached.addAndGet(completedCount);
        }
        maybeLog(label);
    }

    /**
     * Records one failed unit.
     */
    public void fail(String label) {
        failed.incrementAndGet();
        logger.warn("Progress: {}", label);
        maybeLog(null);
    }

    /**
     * Stops the clock and logs the run summary.
     *
     * @return final snapshot
     */
    public ProgressSnapshot complete(String label) {
        endMillis = clock.millis();
        ProgressSnapshot snapshot = snapshot();
        logger.info("{} | processed={}/{} cached={} ({}%) analyzed={} failed={} duration={} speed={}/s",
                label != null ? label : "Batch complete",
                snapshot.getProcessed(), snapshot.getTotal(),
                snapshot.getCached(), String.format("%.1f", snapshot.getCacheHitRate()),
                snapshot.getAnalyzed(), snapshot.getFailed(),
                formatDuration(snapshot.getElapsedSeconds()),
                String.format("%.2f", snapshot.getThroughput()));
        return snapshot;
    }

    public ProgressSnapshot snapshot() {
        int done = completed.get();
        int failures = failed.get();
        double elapsed = elapsedSeconds();
        int processed = done + failures;
        double throughput = elapsed > 0 ? processed / elapsed : 0.0;
        Double eta = null;
        if (processed > 0 && throughput > 0) {
            eta = Math.max(0, total - processed) / throughput;
        }
        return new ProgressSnapshot(total, done, cached.get(), failures, elapsed, throughput, eta);
    }

    private double elapsedSeconds() {
        long start = startMillis;
        if (start < 0) {
            return 0.0;
        }
        long end = endMillis >= 0 ? endMillis : clock.millis();
        return Math.max(0, end - start) / 1000.0;
    }

    private void maybeLog(String label) {
        long now = clock.millis();
        long last = lastLogMillis.get();
        if (now - last < logIntervalMs || !lastLogMillis.compareAndSet(last, now)) {
            return;
        }
        ProgressSnapshot s = snapshot();
        logger.info("Progress: {}/{} ({}%) elapsed={} eta={} speed={}/s cached={} failed={}{}",
                s.getProcessed(), s.getTotal(), String.format("%.1f", s.getPercentage()),
                formatDuration(s.getElapsedSeconds()),
                s.getEtaSeconds() != null ? formatDuration(s.getEtaSeconds()) : "calculating...",
                String.format("%.2f", s.getThroughput()), s.getCached(), s.getFailed(),
                label != null ? " | " + label : "");
    }

    /**
     * Formats seconds as {@code 42s}, {@code 3m 5s} or {@code 1h 12m}.
     */
    public static String formatDuration(double seconds) {
        if (seconds < 60) {
            return Math.round(seconds) + "s";
        }
        if (seconds < 3600) {
            long mins = (long) (seconds / 60);
            long secs = Math.round(seconds % 60);
            return mins + "m " + secs + "s";
        }
        long hours = (long) (seconds / 3600);
        long mins = (long) ((seconds % 3600) / 60);
        return hours + "h " + mins + "m";
    }
}
