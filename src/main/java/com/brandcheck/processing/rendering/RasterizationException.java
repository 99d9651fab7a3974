package com.brandcheck.processing.rendering;

import java.io.IOException;

/**
 * Raised when a document cannot be decomposed into page images.
 */
public class RasterizationException extends IOException {

    public RasterizationException(String message) {
        super(message);
    }

    public RasterizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
