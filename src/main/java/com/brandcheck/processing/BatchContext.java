package com.brandcheck.processing;

import com.brandcheck.processing.concurrency.ConcurrencyLimiter;
import com.brandcheck.processing.model.BatchOptions;
import com.brandcheck.processing.progress.ProgressTracker;

import java.nio.file.Path;

/**
 * Everything shared by the documents of one batch run. Built by {@link BatchOrchestrator} and
 * discarded when the run ends.
 */
public class BatchContext {

    private final String runId;
    private final BatchOptions options;
    private final ConcurrencyLimiter limiter;
    private final IsolatedUnitExecutor unitExecutor;
    private final ProgressTracker progressTracker;
    private final Path workDir;

    public BatchContext(String runId, BatchOptions options, ConcurrencyLimiter limiter,
                        IsolatedUnitExecutor unitExecutor, ProgressTracker progressTracker, Path workDir) {
        this.runId = runId;
        this.options = options;
        this.limiter = limiter;
        this.unitExecutor = unitExecutor;
        this.progressTracker = progressTracker;
        this.workDir = workDir;
    }

    public String getRunId() {
        return runId;
    }

    public BatchOptions getOptions() {
        return options;
    }

    public ConcurrencyLimiter getLimiter() {
        return limiter;
    }

    public IsolatedUnitExecutor getUnitExecutor() {
        return unitExecutor;
    }

    public ProgressTracker getProgressTracker() {
        return progressTracker;
    }

    /**
     * Scratch directory for page images of this run.
     */
    public Path getWorkDir() {
        return workDir;
    }
}
