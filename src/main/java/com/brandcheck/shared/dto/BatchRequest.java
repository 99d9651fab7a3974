package com.brandcheck.shared.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * DTO for starting a batch run. Omitted options fall back to the brandcheck.batch.* defaults.
 */
public class BatchRequest {

    @NotEmpty(message = "At least one document path is required")
    private List<String> documentPaths;

    @Min(value = 1, message = "Concurrency must be at least 1")
    private Integer concurrency;

    private Boolean cacheEnabled;

    @DecimalMin(value = "0.0", message = "Pass threshold must be between 0 and 10")
    @DecimalMax(value = "10.0", message = "Pass threshold must be between 0 and 10")
    private Double passThreshold;

    private List<String> outputFormats;

    public BatchRequest() {
    }

    public BatchRequest(List<String> documentPaths) {
        this.documentPaths = documentPaths;
    }

    public List<String> getDocumentPaths() {
        return documentPaths;
    }

    public void setDocumentPaths(List<String> documentPaths) {
        this.documentPaths = documentPaths;
    }

    public Integer getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(Integer concurrency) {
        this.concurrency = concurrency;
    }

    public Boolean getCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(Boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public Double getPassThreshold() {
        return passThreshold;
    }

    public void setPassThreshold(Double passThreshold) {
        this.passThreshold = passThreshold;
    }

    public List<String> getOutputFormats() {
        return outputFormats;
    }

    public void setOutputFormats(List<String> outputFormats) {
        this.outputFormats = outputFormats;
    }
}
