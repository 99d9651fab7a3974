package com.brandcheck.processing.model;

/**
 * Failure taxonomy for page and document processing.
 */
public enum ErrorKind {
    /** Provider call exceeded the per-page deadline. */
    TIMEOUT,
    /** Provider reported an error or could not be reached. */
    PROVIDER_ERROR,
    /** Provider response could not be interpreted as a valid analysis. */
    PARSE_ERROR,
    /** Document could not be decomposed into pages. */
    RASTERIZATION_ERROR,
    /** Cache storage unavailable. Downgraded to a warning, never surfaced as a page failure. */
    CACHE_ERROR,
    /** Anything else raised inside the isolated execution context. */
    INTERNAL_ERROR
}
