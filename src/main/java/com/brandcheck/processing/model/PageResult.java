package com.brandcheck.processing.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of one {@link WorkUnit}: either a success carrying the analysis or a failure
 * carrying the {@link ErrorKind}. Never mutated after creation.
 */
public final class PageResult {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    private final String documentId;
    private final int pageNumber;
    private final Status status;
    private final double score;
    private final double brandComplianceScore;
    private final List<String> criticalViolations;
    private final List<String> violations;
    private final boolean fromCache;
    private final long durationMs;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private PageResult(String documentId, int pageNumber, Status status, double score,
                       double brandComplianceScore, List<String> criticalViolations,
                       List<String> violations, boolean fromCache, long durationMs,
                       ErrorKind errorKind, String errorMessage) {
        this.documentId = documentId;
        this.pageNumber = pageNumber;
        this.status = status;
        this.score = score;
        this.brandComplianceScore = brandComplianceScore;
        this.criticalViolations = copyWithoutNulls(criticalViolations);
        this.violations = copyWithoutNulls(violations);
        this.fromCache = fromCache;
        this.durationMs = durationMs;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static PageResult success(WorkUnit unit, PageAnalysis analysis, boolean fromCache, long durationMs) {
        return new PageResult(unit.getDocumentId(), unit.getPageNumber(), Status.SUCCESS,
                analysis.getOverallScore(), analysis.getBrandComplianceScore(),
                analysis.getCriticalViolations(), analysis.getViolations(),
                fromCache, durationMs, null, null);
    }

    public static PageResult failure(WorkUnit unit, ErrorKind errorKind, String errorMessage, long durationMs) {
        return new PageResult(unit.getDocumentId(), unit.getPageNumber(), Status.FAILURE,
                0.0, 0.0, null, null, false, durationMs, errorKind, errorMessage);
    }

    private static List<String> copyWithoutNulls(List<String> values) {
        if (values == null) {
            return Collections.emptyList();
        }
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public double getScore() {
        return score;
    }

    public double getBrandComplianceScore() {
        return brandComplianceScore;
    }

    public List<String> getCriticalViolations() {
        return criticalViolations;
    }

    public List<String> getViolations() {
        return violations;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("PageResult{%s p%d score=%.2f cached=%s}", documentId, pageNumber, score, fromCache)
                : String.format("PageResult{%s p%d %s: %s}", documentId, pageNumber, errorKind, errorMessage);
    }
}
