package com.brandcheck.processing.cache;

import java.util.Optional;

/**
 * Content-addressable store of analysis results keyed by fingerprint.
 * Implementations never throw on storage problems: a broken store behaves as a permanent miss.
 * Entries do not expire; changing the analysis method changes the fingerprint instead.
 */
public interface AnalysisCache {

    /**
     * Returns the stored entry for the fingerprint, or empty on a miss.
     * Never waits for another unit computing the same fingerprint.
     */
    Optional<CacheEntry> lookup(String fingerprint);

    /**
     * Stores the entry, replacing any previous one atomically. Last writer wins.
     */
    void store(String fingerprint, CacheEntry entry);

    CacheStatistics statistics();
}
