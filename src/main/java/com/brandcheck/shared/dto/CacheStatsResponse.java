package com.brandcheck.shared.dto;

/**
 * DTO for cache statistics: session counters plus what is currently on disk.
 */
public class CacheStatsResponse {

    private final String cacheDir;
    private final long entryCount;
    private final long totalBytes;
    private final long hits;
    private final long misses;
    private final long stores;
    private final long errors;
    private final double hitRate;

    public CacheStatsResponse(String cacheDir, long entryCount, long totalBytes, long hits, long misses,
                              long stores, long errors, double hitRate) {
        this.cacheDir = cacheDir;
        this.entryCount = entryCount;
        this.totalBytes = totalBytes;
        this.hits = hits;
        this.misses = misses;
        this.stores = stores;
        this.errors = errors;
        this.hitRate = hitRate;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public long getEntryCount() {
        return entryCount;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getStores() {
        return stores;
    }

    public long getErrors() {
        return errors;
    }

    /**
     * Session hit rate in percent.
     */
    public double getHitRate() {
        return hitRate;
    }
}
