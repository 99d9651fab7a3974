package com.brandcheck.processing.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Session counters of a cache instance. Safe for concurrent updates.
 */
public class CacheStatistics {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordStore() {
        stores.incrementAndGet();
    }

    void recordError() {
        errors.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getStores() {
        return stores.get();
    }

    public long getErrors() {
        return errors.get();
    }

    /**
     * Hit rate in percent over all lookups of this session, 0 when nothing was looked up.
     */
    public double getHitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total > 0 ? (h * 100.0) / total : 0.0;
    }
}
