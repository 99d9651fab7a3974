package com.brandcheck.processing.cache;

import com.brandcheck.processing.model.PageAnalysis;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Persisted cache record: fingerprint -> analysis result.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheEntry {

    private String fingerprint;
    private String methodVersion;
    private Instant storedAt;
    private String sourceName;
    private PageAnalysis result;

    public CacheEntry() {
    }

    public CacheEntry(String fingerprint, String methodVersion, String sourceName, PageAnalysis result) {
        this.fingerprint = fingerprint;
        this.methodVersion = methodVersion;
        this.sourceName = sourceName;
        this.result = result;
        this.storedAt = Instant.now();
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getMethodVersion() {
        return methodVersion;
    }

    public void setMethodVersion(String methodVersion) {
        this.methodVersion = methodVersion;
    }

    public Instant getStoredAt() {
        return storedAt;
    }

    public void setStoredAt(Instant storedAt) {
        this.storedAt = storedAt;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public PageAnalysis getResult() {
        return result;
    }

    public void setResult(PageAnalysis result) {
        this.result = result;
    }
}
