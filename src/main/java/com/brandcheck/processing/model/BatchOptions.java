package com.brandcheck.processing.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Per-run settings for {@code BatchOrchestrator.run}.
 */
public final class BatchOptions {

    private final int concurrency;
    private final boolean cacheEnabled;
    private final List<String> outputFormats;
    private final double passThreshold;

    public BatchOptions(int concurrency, boolean cacheEnabled, List<String> outputFormats, double passThreshold) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        this.concurrency = concurrency;
        this.cacheEnabled = cacheEnabled;
        this.outputFormats = outputFormats != null
                ? outputFormats.stream()
                        .map(f -> f.trim().toLowerCase(Locale.ROOT))
                        .filter(f -> !f.isEmpty())
                        .distinct()
                        .collect(Collectors.toUnmodifiableList())
                : Collections.emptyList();
        this.passThreshold = passThreshold;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public List<String> getOutputFormats() {
        return outputFormats;
    }

    public double getPassThreshold() {
        return passThreshold;
    }

    @Override
    public String toString() {
        return "BatchOptions{concurrency=" + concurrency + ", cacheEnabled=" + cacheEnabled
                + ", outputFormats=" + outputFormats + ", passThreshold=" + passThreshold + "}";
    }
}
