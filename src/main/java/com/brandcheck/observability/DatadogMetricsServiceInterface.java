package com.brandcheck.observability;

/**
 * Engine metrics, with a real Micrometer implementation and a no-op stub.
 */
public interface DatadogMetricsServiceInterface {
    void recordLlmLatency(long durationMs, String model);
    void recordLlmCostEstimate(double costUsd, String model);
    void recordCacheLookup(boolean hit);
    void recordPageSuccess(long durationMs, boolean fromCache);
    void recordPageFailure(String errorKind);
    void recordDocumentVerdict(boolean passed, boolean unprocessable);
    void recordBatchDuration(long durationMs, int documentCount);
}
