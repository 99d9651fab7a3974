package com.brandcheck.processing.analysis;

/**
 * Per-page context handed to the analysis provider alongside the page image.
 */
public class PromptContext {

    private final String documentId;
    private final int pageNumber;

    public PromptContext(String documentId, int pageNumber) {
        this.documentId = documentId;
        this.pageNumber = pageNumber;
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
