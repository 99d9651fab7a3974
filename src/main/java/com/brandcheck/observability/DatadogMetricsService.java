package com.brandcheck.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Custom Datadog metrics for the validation engine. Only active when datadog.enabled=true.
 *
 * Metrics:
 * - brandcheck.llm.latency_ms: Timer for provider call latency
 * - brandcheck.llm.cost_estimate_usd: Counter for estimated provider cost
 * - brandcheck.cache.lookups: Counter tagged result=hit|miss
 * - brandcheck.page.duration: Timer for page execution, tagged source=cache|provider
 * - brandcheck.page.failure: Counter tagged error_kind
 * - brandcheck.document.verdict: Counter tagged outcome=passed|failed|unprocessable
 * - brandcheck.batch.duration: Timer for whole batch runs
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsService implements DatadogMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsService.class);
    private static final String SERVICE_TAG = "brand-check";

    private final MeterRegistry meterRegistry;
    private final Timer batchDurationTimer;

    public DatadogMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.batchDurationTimer = Timer.builder("brandcheck.batch.duration")
                .description("Batch run wall-clock duration")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
        logger.info("DatadogMetricsService initialized");
    }

    @Override
    public void recordLlmLatency(long durationMs, String model) {
        Timer.builder("brandcheck.llm.latency_ms")
                .description("Analysis provider call latency in milliseconds")
                .tag("service", SERVICE_TAG)
                .tag("model", model != null ? model : "unknown")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordLlmCostEstimate(double costUsd, String model) {
        Counter.builder("brandcheck.llm.cost_estimate_usd")
                .description("Estimated analysis provider cost in USD")
                .tag("service", SERVICE_TAG)
                .tag("model", model != null ? model : "unknown")
                .register(meterRegistry)
                .increment(costUsd);
    }

    @Override
    public void recordCacheLookup(boolean hit) {
        Counter.builder("brandcheck.cache.lookups")
                .description("Analysis cache lookups")
                .tag("service", SERVICE_TAG)
                .tag("result", hit ? "hit" : "miss")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordPageSuccess(long durationMs, boolean fromCache) {
        Timer.builder("brandcheck.page.duration")
                .description("Page execution duration")
                .tag("service", SERVICE_TAG)
                .tag("source", fromCache ? "cache" : "provider")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordPageFailure(String errorKind) {
        Counter.builder("brandcheck.page.failure")
                .description("Pages that ended in a failure result")
                .tag("service", SERVICE_TAG)
                .tag("error_kind", errorKind != null ? errorKind : "unknown")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordDocumentVerdict(boolean passed, boolean unprocessable) {
        String outcome = unprocessable ? "unprocessable" : (passed ? "passed" : "failed");
        Counter.builder("brandcheck.document.verdict")
                .description("Document verdicts by outcome")
                .tag("service", SERVICE_TAG)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordBatchDuration(long durationMs, int documentCount) {
        batchDurationTimer.record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded batch duration: {}ms for {} documents", durationMs, documentCount);
    }
}
