package com.brandcheck.processing.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Final output of a batch run. Plain structured record, consumed read-only by report writers.
 */
public final class BatchReport {

    private final String runId;
    private final Instant generatedAt;
    private final List<DocumentVerdict> documents;
    private final int totalDocuments;
    private final int passedDocuments;
    private final int failedDocuments;
    private final int unprocessableDocuments;
    private final int belowThresholdDocuments;
    private final int totalPages;
    private final int cachedPages;
    private final int analyzedPages;
    private final int failedPages;
    private final double averageScore;
    private final long wallClockDurationMs;
    private final double cacheHitRate;

    public BatchReport(String runId, Instant generatedAt, List<DocumentVerdict> documents,
                       int passedDocuments, int unprocessableDocuments, int belowThresholdDocuments,
                       int totalPages, int cachedPages, int analyzedPages, int failedPages,
                       double averageScore, long wallClockDurationMs, double cacheHitRate) {
        this.runId = runId;
        this.generatedAt = generatedAt;
        this.documents = documents != null ? List.copyOf(documents) : Collections.emptyList();
        this.totalDocuments = this.documents.size();
        this.passedDocuments = passedDocuments;
        this.failedDocuments = this.totalDocuments - passedDocuments;
        this.unprocessableDocuments = unprocessableDocuments;
        this.belowThresholdDocuments = belowThresholdDocuments;
        this.totalPages = totalPages;
        this.cachedPages = cachedPages;
        this.analyzedPages = analyzedPages;
        this.failedPages = failedPages;
        this.averageScore = averageScore;
        this.wallClockDurationMs = wallClockDurationMs;
        this.cacheHitRate = cacheHitRate;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public List<DocumentVerdict> getDocuments() {
        return documents;
    }

    public int getTotalDocuments() {
        return totalDocuments;
    }

    public int getPassedDocuments() {
        return passedDocuments;
    }

    public int getFailedDocuments() {
        return failedDocuments;
    }

    public int getUnprocessableDocuments() {
        return unprocessableDocuments;
    }

    public int getBelowThresholdDocuments() {
        return belowThresholdDocuments;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public int getCachedPages() {
        return cachedPages;
    }

    public int getAnalyzedPages() {
        return analyzedPages;
    }

    public int getFailedPages() {
        return failedPages;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public long getWallClockDurationMs() {
        return wallClockDurationMs;
    }

    /**
     * Percentage (0-100) of pages served from cache.
     */
    public double getCacheHitRate() {
        return cacheHitRate;
    }

    public boolean isAllPassed() {
        return failedDocuments == 0;
    }

    /**
     * Process exit status: 0 when every document passed, 1 otherwise.
     */
    public int exitCode() {
        return isAllPassed() ? 0 : 1;
    }
}
