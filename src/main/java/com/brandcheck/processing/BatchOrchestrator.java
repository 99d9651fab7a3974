package com.brandcheck.processing;

import com.brandcheck.observability.DatadogMetricsServiceInterface;
import com.brandcheck.observability.TracingServiceInterface;
import com.brandcheck.processing.analysis.PageAnalysisProvider;
import com.brandcheck.processing.cache.AnalysisCache;
import com.brandcheck.processing.cache.ContentFingerprinter;
import com.brandcheck.processing.cache.DisabledAnalysisCache;
import com.brandcheck.processing.cache.FileAnalysisCache;
import com.brandcheck.processing.concurrency.ConcurrencyLimiter;
import com.brandcheck.processing.model.BatchOptions;
import com.brandcheck.processing.model.BatchReport;
import com.brandcheck.processing.model.DocumentVerdict;
import com.brandcheck.processing.progress.ProgressTracker;
import com.brandcheck.processing.rendering.DocumentRasterizer;
import com.brandcheck.processing.rendering.RasterizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Stream;

/**
 * Runs a batch of documents through one shared {@link ConcurrencyLimiter}, so the whole run never
 * has more than {@code concurrency} page analyses in flight, and aggregates the verdicts into a
 * {@link BatchReport}.
 */
@Service
public class BatchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final DocumentProcessor documentProcessor;
    private final DocumentRasterizer rasterizer;
    private final PageAnalysisProvider provider;
    private final FileAnalysisCache fileCache;
    private final ContentFingerprinter fingerprinter;
    private final BatchReportWriter reportWriter;
    private final ExecutorService analysisExecutor;
    private final ExecutorService isolationExecutor;
    private final Duration pageTimeout;
    private final long progressIntervalMs;
    private final String tempDir;
    private final DatadogMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;

    public BatchOrchestrator(
            DocumentProcessor documentProcessor,
            DocumentRasterizer rasterizer,
            PageAnalysisProvider provider,
            FileAnalysisCache fileCache,
            ContentFingerprinter fingerprinter,
            BatchReportWriter reportWriter,
            @Qualifier("analysisExecutor") ExecutorService analysisExecutor,
            @Qualifier("isolationExecutor") ExecutorService isolationExecutor,
            @Value("${brandcheck.batch.page-timeout-seconds:120}") long pageTimeoutSeconds,
            @Value("${brandcheck.batch.progress-interval-ms:500}") long progressIntervalMs,
            @Value("${brandcheck.rasterizer.temp-dir:}") String tempDir,
            @Autowired(required = false) DatadogMetricsServiceInterface metricsService,
            @Autowired(required = false) TracingServiceInterface tracingService) {
        this.documentProcessor = documentProcessor;
        this.rasterizer = rasterizer;
        this.provider = provider;
        this.fileCache = fileCache;
        this.fingerprinter = fingerprinter;
        this.reportWriter = reportWriter;
        this.analysisExecutor = analysisExecutor;
        this.isolationExecutor = isolationExecutor;
        this.pageTimeout = Duration.ofSeconds(pageTimeoutSeconds);
        this.progressIntervalMs = progressIntervalMs;
        this.tempDir = tempDir;
        this.metricsService = metricsService;
        this.tracingService = tracingService;

        logger.info("BatchOrchestrator initialized: pageTimeout={}s, methodVersion={}",
                pageTimeoutSeconds, provider.methodVersion());
    }

    /**
     * Validates every document and returns the report. Individual document or page failures are
     * reported in the result, never thrown.
     *
     * @throws UncheckedIOException if the run's scratch directory cannot be created
     */
    public BatchReport run(List<Path> documents, BatchOptions options) {
        if (tracingService != null) {
            return tracingService.trace("batch.run", () -> doRun(documents, options));
        }
        return doRun(documents, options);
    }

    private BatchReport doRun(List<Path> documents, BatchOptions options) {
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        long startTime = System.currentTimeMillis();
        Path workDir = null;
        try {
            logger.info("Starting batch run: documents={}, options={}", documents.size(), options);

            int estimatedPages = countPages(documents);
            AnalysisCache cache = options.isCacheEnabled() ? fileCache : new DisabledAnalysisCache();
            ConcurrencyLimiter limiter = new ConcurrencyLimiter(options.getConcurrency(), analysisExecutor);
            IsolatedUnitExecutor unitExecutor = new IsolatedUnitExecutor(provider, cache, fingerprinter,
                    isolationExecutor, pageTimeout, metricsService);
            ProgressTracker tracker = new ProgressTracker(estimatedPages, progressIntervalMs);
            workDir = createWorkDir(runId);
            BatchContext context = new BatchContext(runId, options, limiter, unitExecutor, tracker, workDir);

            tracker.start();
            List<CompletableFuture<DocumentVerdict>> pending = new ArrayList<>(documents.size());
            for (Path document : documents) {
                pending.add(documentProcessor.submit(document, context));
            }

            List<DocumentVerdict> verdicts = new ArrayList<>(pending.size());
            for (CompletableFuture<DocumentVerdict> future : pending) {
                verdicts.add(future.join());
            }
            tracker.complete("Batch " + runId + " complete");

            long durationMs = System.currentTimeMillis() - startTime;
            BatchReport report = VerdictAggregator.buildReport(runId, Instant.now(), verdicts, durationMs);
            logger.info("Batch run finished: documents={}, passed={}, unprocessable={}, belowThreshold={}, "
                            + "pages={}, cacheHitRate={}%, averageScore={}, peakInFlight={}, duration={}ms",
                    report.getTotalDocuments(), report.getPassedDocuments(), report.getUnprocessableDocuments(),
                    report.getBelowThresholdDocuments(), report.getTotalPages(),
                    String.format("%.1f", report.getCacheHitRate()), String.format("%.2f", report.getAverageScore()),
                    limiter.peakInFlight(), durationMs);

            writeReports(report, options);
            recordMetrics(report);
            return report;
        } finally {
            deleteRecursively(workDir);
            MDC.remove("runId");
        }
    }

    /**
     * Sizes progress reporting before any rendering. A document that cannot be inspected counts as one page.
     */
    private int countPages(List<Path> documents) {
        int total = 0;
        for (Path document : documents) {
            try {
                total += rasterizer.countPages(document);
            } catch (RasterizationException e) {
                logger.debug("Could not count pages of {}, estimating 1: {}", document, e.getMessage());
                total += 1;
            } catch (RuntimeException e) {
                logger.warn("Page count of {} failed unexpectedly, estimating 1: {}", document, e.toString());
                total += 1;
            }
        }
        return total;
    }

    private Path createWorkDir(String runId) {
        try {
            if (tempDir == null || tempDir.isBlank()) {
                return Files.createTempDirectory("brandcheck-" + runId + "-");
            }
            Path base = Paths.get(tempDir);
            Files.createDirectories(base);
            return Files.createTempDirectory(base, "brandcheck-" + runId + "-");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create work directory for run " + runId, e);
        }
    }

    private void writeReports(BatchReport report, BatchOptions options) {
        for (String format : options.getOutputFormats()) {
            if (!BatchReportWriter.JSON_FORMAT.equals(format)) {
                logger.warn("Output format '{}' is not produced by the engine, skipping", format);
                continue;
            }
            try {
                reportWriter.writeJson(report);
            } catch (IOException e) {
                logger.error("Failed to write JSON report to {}: {}", reportWriter.getReportDir(), e.getMessage(), e);
            }
        }
    }

    private void recordMetrics(BatchReport report) {
        if (metricsService == null) {
            return;
        }
        for (DocumentVerdict verdict : report.getDocuments()) {
            metricsService.recordDocumentVerdict(verdict.isPassed(), verdict.isUnprocessable());
        }
        metricsService.recordBatchDuration(report.getWallClockDurationMs(), report.getTotalDocuments());
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.debug("Could not delete temp file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to clean up work directory {}: {}", dir, e.getMessage());
        }
    }
}
