package com.brandcheck.processing.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;

/**
 * Aggregated verdict for one document. Built once every page of the document has resolved.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DocumentVerdict {

    private final String documentId;
    private final String documentPath;
    private final int totalPages;
    private final int successfulPages;
    private final int failedPages;
    private final double aggregateScore;
    private final double brandComplianceScore;
    private final String grade;
    private final List<String> violations;
    private final boolean passed;
    private final String error;
    private final List<PageResult> pageResults;

    public DocumentVerdict(String documentId, String documentPath, int totalPages, int successfulPages,
                           int failedPages, double aggregateScore, double brandComplianceScore,
                           String grade, List<String> violations, boolean passed, String error,
                           List<PageResult> pageResults) {
        this.documentId = documentId;
        this.documentPath = documentPath;
        this.totalPages = totalPages;
        this.successfulPages = successfulPages;
        this.failedPages = failedPages;
        this.aggregateScore = aggregateScore;
        this.brandComplianceScore = brandComplianceScore;
        this.grade = grade;
        this.violations = violations != null ? List.copyOf(violations) : Collections.emptyList();
        this.passed = passed;
        this.error = error;
        this.pageResults = pageResults != null ? List.copyOf(pageResults) : Collections.emptyList();
    }

    /**
     * Verdict for a document that could not be decomposed into pages.
     */
    public static DocumentVerdict unprocessable(String documentId, String documentPath, String error) {
        return new DocumentVerdict(documentId, documentPath, 0, 0, 0, 0.0, 0.0, "F",
                Collections.emptyList(), false, error, Collections.emptyList());
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public int getSuccessfulPages() {
        return successfulPages;
    }

    public int getFailedPages() {
        return failedPages;
    }

    public double getAggregateScore() {
        return aggregateScore;
    }

    public double getBrandComplianceScore() {
        return brandComplianceScore;
    }

    public String getGrade() {
        return grade;
    }

    public List<String> getViolations() {
        return violations;
    }

    public boolean isPassed() {
        return passed;
    }

    public String getError() {
        return error;
    }

    /**
     * True when the document never reached analysis (fix the file, not the content).
     */
    public boolean isUnprocessable() {
        return error != null;
    }

    public List<PageResult> getPageResults() {
        return pageResults;
    }
}
