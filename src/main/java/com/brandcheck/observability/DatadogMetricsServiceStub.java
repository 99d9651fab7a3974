package com.brandcheck.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Stub implementation when Datadog is disabled.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class DatadogMetricsServiceStub implements DatadogMetricsServiceInterface {

    @Override
    public void recordLlmLatency(long durationMs, String model) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordLlmCostEstimate(double costUsd, String model) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordCacheLookup(boolean hit) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordPageSuccess(long durationMs, boolean fromCache) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordPageFailure(String errorKind) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordDocumentVerdict(boolean passed, boolean unprocessable) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordBatchDuration(long durationMs, int documentCount) {
        // No-op when Datadog is disabled
    }
}
