package com.brandcheck.processing.analysis;

import java.io.IOException;

/**
 * Provider answered, but the answer is not a usable page analysis.
 */
public class AnalysisParseException extends IOException {

    public AnalysisParseException(String message) {
        super(message);
    }

    public AnalysisParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
