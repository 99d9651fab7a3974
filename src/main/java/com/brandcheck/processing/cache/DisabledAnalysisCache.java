package com.brandcheck.processing.cache;

import java.util.Optional;

/**
 * Cache used when caching is switched off for a run: every lookup misses, stores are dropped.
 */
public class DisabledAnalysisCache implements AnalysisCache {

    private final CacheStatistics statistics = new CacheStatistics();

    @Override
    public Optional<CacheEntry> lookup(String fingerprint) {
        statistics.recordMiss();
        return Optional.empty();
    }

    @Override
    public void store(String fingerprint, CacheEntry entry) {
        // nothing is kept
    }

    @Override
    public CacheStatistics statistics() {
        return statistics;
    }
}
