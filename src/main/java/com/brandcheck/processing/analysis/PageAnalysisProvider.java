package com.brandcheck.processing.analysis;

import com.brandcheck.processing.model.PageAnalysis;
import com.brandcheck.processing.model.PageImage;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * External page analysis (an AI vision call). Slow and billed per call.
 */
public interface PageAnalysisProvider {

    /**
     * Analyzes one page image.
     *
     * @throws AnalysisParseException if the response cannot be interpreted
     * @throws IOException if the provider reports an error or cannot be reached
     * @throws TimeoutException if the provider enforces its own deadline and exceeds it
     */
    PageAnalysis analyze(PageImage page, PromptContext context) throws IOException, TimeoutException;

    /**
     * Identity of the analysis method (model, prompt). Part of every cache key, so changing it
     * invalidates all earlier results.
     */
    String methodVersion();
}
