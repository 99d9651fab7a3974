package com.brandcheck.processing.model;

import java.util.Objects;

/**
 * One page of one document awaiting analysis.
 * The fingerprint is not stored here; the executor derives it when the unit runs.
 */
public class WorkUnit {

    private final String documentId;
    private final int pageNumber;
    private final PageImage contentRef;

    public WorkUnit(String documentId, int pageNumber, PageImage contentRef) {
        this.documentId = Objects.requireNonNull(documentId, "documentId is required");
        this.pageNumber = pageNumber;
        this.contentRef = Objects.requireNonNull(contentRef, "contentRef is required");
    }

    public static WorkUnit of(String documentId, PageImage page) {
        return new WorkUnit(documentId, page.getPageNumber(), page);
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public PageImage getContentRef() {
        return contentRef;
    }

    /**
     * Human readable label used in progress and log lines.
     */
    public String label() {
        return documentId + " - Page " + pageNumber;
    }
}
