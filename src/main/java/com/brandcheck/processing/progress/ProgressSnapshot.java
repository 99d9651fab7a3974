package com.brandcheck.processing.progress;

/**
 * Point-in-time view of a {@link ProgressTracker}.
 */
public class ProgressSnapshot {

    private final int total;
    private final int completed;
    private final int cached;
    private final int failed;
    private final double elapsedSeconds;
    private final double throughput;
    private final Double etaSeconds;

    public ProgressSnapshot(int total, int completed, int cached, int failed,
                            double elapsedSeconds, double throughput, Double etaSeconds) {
        this.total = total;
        this.completed = completed;
        this.cached = cached;
        this.failed = failed;
        this.elapsedSeconds = elapsedSeconds;
        this.throughput = throughput;
        this.etaSeconds = etaSeconds;
    }

    public int getTotal() {
        return total;
    }

    /** Units that finished successfully, cached ones included. */
    public int getCompleted() {
        return completed;
    }

    public int getCached() {
        return cached;
    }

    public int getAnalyzed() {
        return completed - cached;
    }

    public int getFailed() {
        return failed;
    }

    public int getProcessed() {
        return completed + failed;
    }

    public int getRemaining() {
        return Math.max(0, total - getProcessed());
    }

    public double getPercentage() {
        return total > 0 ? Math.min(100.0, getProcessed() * 100.0 / total) : 100.0;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    /** Units per second since start. */
    public double getThroughput() {
        return throughput;
    }

    /** Seconds until done at current throughput, or null while nothing has finished yet. */
    public Double getEtaSeconds() {
        return etaSeconds;
    }

    public double getCacheHitRate() {
        int processed = getProcessed();
        return processed > 0 ? cached * 100.0 / processed : 0.0;
    }
}
