package com.brandcheck.processing.analysis;

import com.brandcheck.observability.DatadogMetricsServiceInterface;
import com.brandcheck.observability.TracingServiceInterface;
import com.brandcheck.processing.model.PageAnalysis;
import com.brandcheck.processing.model.PageImage;
import com.google.genai.Client;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.TimeoutException;

/**
 * Brand review of a single page image through Vertex AI Gemini.
 * Runs in stub mode when vertexai.enabled=false, returning a fixed passing analysis.
 * When enabled=true, uses the Google Gen AI SDK with ADC (Application Default Credentials).
 */
@Service
public class GeminiPageAnalysisProvider implements PageAnalysisProvider {

    private static final Logger logger = LoggerFactory.getLogger(GeminiPageAnalysisProvider.class);
    private static final String DEFAULT_MODEL = "gemini-2.0-flash";

    // Approximate Gemini Flash pricing, USD per 1K tokens
    private static final double INPUT_COST_PER_1K_TOKENS = 0.0005;
    private static final double OUTPUT_COST_PER_1K_TOKENS = 0.0015;
    // An inline image is billed as a flat token count
    private static final int IMAGE_TOKENS = 258;

    static final String STUB_RESPONSE = "{"
            + "\"overallScore\": 9.0,"
            + "\"gradeLevel\": \"A\","
            + "\"brandCompliance\": {\"score\": 9.0,"
            + " \"colors\": {\"pass\": true, \"issues\": []},"
            + " \"typography\": {\"pass\": true, \"issues\": []}},"
            + "\"criticalViolations\": [],"
            + "\"recommendations\": [],"
            + "\"summary\": \"Stub analysis (vertexai.enabled=false)\""
            + "}";

    private final boolean enabled;
    private final String projectId;
    private final String location;
    private final String model;
    private final String promptVersion;
    private final String prompt;
    private final PageAnalysisParser parser;
    private final DatadogMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;
    private Client client;

    public GeminiPageAnalysisProvider(
            @Value("${vertexai.enabled:false}") boolean enabled,
            @Value("${vertexai.project-id:${GOOGLE_CLOUD_PROJECT:local-project}}") String projectId,
            @Value("${vertexai.location:us-central1}") String location,
            @Value("${vertexai.model:gemini-2.0-flash}") String model,
            @Value("${vertexai.prompt-version:v1}") String promptVersion,
            @Value("classpath:prompts/brand-review.txt") Resource promptResource,
            PageAnalysisParser parser,
            @Autowired(required = false) DatadogMetricsServiceInterface metricsService,
            @Autowired(required = false) TracingServiceInterface tracingService) {
        this.enabled = enabled;
        this.projectId = projectId;
        this.location = location;
        this.model = model != null && !model.isEmpty() ? model : DEFAULT_MODEL;
        this.promptVersion = promptVersion;
        this.prompt = loadPrompt(promptResource);
        this.parser = parser;
        this.metricsService = metricsService;
        this.tracingService = tracingService;

        logger.info("GeminiPageAnalysisProvider initialized: enabled={}, projectId={}, location={}, model={}, methodVersion={}",
                this.enabled, this.projectId, this.location, this.model, methodVersion());

        if (this.enabled && !"local-project".equals(projectId)) {
            this.client = initializeClient();
        } else {
            logger.info("Vertex AI disabled or using local project, will use stub mode for local development");
        }
    }

    private Client initializeClient() {
        try {
            Client clientInstance = Client.builder()
                    .project(this.projectId)
                    .location(this.location)
                    .vertexAI(true)
                    .httpOptions(HttpOptions.builder().apiVersion("v1").build())
                    .build();
            logger.info("Google Gen AI SDK client initialized successfully with Vertex AI enabled");
            return clientInstance;
        } catch (Exception e) {
            logger.error("Failed to initialize Google Gen AI SDK client: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to initialize Google Gen AI SDK client", e);
        }
    }

    private static String loadPrompt(Resource promptResource) {
        try (InputStream in = promptResource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Brand review prompt not found: " + promptResource, e);
        }
    }

    @Override
    public String methodVersion() {
        return model + ":" + promptVersion;
    }

    @Override
    public PageAnalysis analyze(PageImage page, PromptContext context) throws IOException, TimeoutException {
        logger.debug("Calling Gemini API: enabled={}, model={}, page={}", enabled, model, page.getPath());

        long startTime = System.currentTimeMillis();
        Span llmSpan = null;
        if (tracingService != null) {
            llmSpan = tracingService.spanBuilder("llm.call")
                    .setAttribute("stage", "llm")
                    .setAttribute("provider", "gemini")
                    .setAttribute("model", model)
                    .setAttribute("document_id", context.getDocumentId())
                    .setAttribute("page_number", context.getPageNumber())
                    .startSpan();
        }

        try (Scope scope = llmSpan != null ? llmSpan.makeCurrent() : null) {
            String responseText = enabled ? callGemini(page, context, startTime, llmSpan) : STUB_RESPONSE;
            if (!enabled && metricsService != null) {
                metricsService.recordLlmLatency(System.currentTimeMillis() - startTime, model);
            }
            PageAnalysis analysis = parser.parse(responseText);
            if (llmSpan != null) {
                llmSpan.setAttribute("stub_mode", !enabled);
                llmSpan.setAttribute("overall_score", analysis.getOverallScore());
                llmSpan.setStatus(StatusCode.OK);
            }
            return analysis;
        } catch (IOException e) {
            if (llmSpan != null) {
                llmSpan.setStatus(StatusCode.ERROR);
                llmSpan.setAttribute("error.message", String.valueOf(e.getMessage()));
                llmSpan.recordException(e);
            }
            throw e;
        } finally {
            if (llmSpan != null) {
                llmSpan.end();
            }
        }
    }

    private String callGemini(PageImage page, PromptContext context, long startTime, Span llmSpan) throws IOException {
        if (client == null) {
            throw new IOException("Vertex AI is enabled but client initialization failed");
        }

        byte[] imageBytes = Files.readAllBytes(page.getPath());
        Content content = Content.fromParts(
                Part.fromText(prompt + "\n\nDocument: " + context.getDocumentId() + ", page " + context.getPageNumber()),
                Part.fromBytes(imageBytes, page.getMimeType()));
        GenerateContentConfig config = GenerateContentConfig.builder()
                .responseMimeType("application/json")
                .temperature(0.2f)
                .build();

        String responseText;
        try {
            GenerateContentResponse response = client.models.generateContent(model, content, config);
            responseText = response.text();
        } catch (RuntimeException e) {
            logger.error("Gemini API call failed for {} page {}: {}",
                    context.getDocumentId(), context.getPageNumber(), e.getMessage());
            if (metricsService != null) {
                metricsService.recordLlmLatency(System.currentTimeMillis() - startTime, model);
            }
            throw new IOException("Gemini API call failed: " + e.getMessage(), e);
        }

        if (responseText == null || responseText.isBlank()) {
            throw new IOException("Gemini API returned empty or null response");
        }

        long durationMs = System.currentTimeMillis() - startTime;
        // Rough approximation: 1 token per 4 chars of text
        int estimatedInputTokens = prompt.length() / 4 + IMAGE_TOKENS;
        int estimatedOutputTokens = responseText.length() / 4;
        double estimatedCost = (estimatedInputTokens * INPUT_COST_PER_1K_TOKENS / 1000.0)
                + (estimatedOutputTokens * OUTPUT_COST_PER_1K_TOKENS / 1000.0);

        if (metricsService != null) {
            metricsService.recordLlmLatency(durationMs, model);
            metricsService.recordLlmCostEstimate(estimatedCost, model);
        }
        if (llmSpan != null) {
            llmSpan.setAttribute("duration_ms", durationMs);
            llmSpan.setAttribute("tokens.input", estimatedInputTokens);
            llmSpan.setAttribute("tokens.output", estimatedOutputTokens);
            llmSpan.setAttribute("cost_estimate_usd", estimatedCost);
        }

        logger.debug("Gemini API call successful, duration={}ms, responseLength={}", durationMs, responseText.length());
        return responseText;
    }
}
