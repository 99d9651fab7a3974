package com.brandcheck.processing;

import com.brandcheck.observability.DatadogMetricsServiceInterface;
import com.brandcheck.processing.analysis.AnalysisParseException;
import com.brandcheck.processing.analysis.PageAnalysisProvider;
import com.brandcheck.processing.analysis.PromptContext;
import com.brandcheck.processing.cache.AnalysisCache;
import com.brandcheck.processing.cache.CacheEntry;
import com.brandcheck.processing.cache.ContentFingerprinter;
import com.brandcheck.processing.model.ErrorKind;
import com.brandcheck.processing.model.PageAnalysis;
import com.brandcheck.processing.model.PageResult;
import com.brandcheck.processing.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one {@link WorkUnit} end to end: fingerprint, cache lookup, provider call under a hard
 * timeout, cache store. Every outcome is returned as a {@link PageResult}; nothing is thrown.
 * <p>
 * The provider call runs on a separate isolation pool so an unresponsive provider is abandoned
 * at the deadline and the caller's limiter slot is freed. No retries: one {@code execute} issues
 * at most one provider call.
 */
public class IsolatedUnitExecutor {

    private static final Logger logger = LoggerFactory.getLogger(IsolatedUnitExecutor.class);

    private final PageAnalysisProvider provider;
    private final AnalysisCache cache;
    private final ContentFingerprinter fingerprinter;
    private final ExecutorService isolationExecutor;
    private final Duration timeout;
    private final DatadogMetricsServiceInterface metricsService;

    public IsolatedUnitExecutor(PageAnalysisProvider provider, AnalysisCache cache,
                                ContentFingerprinter fingerprinter, ExecutorService isolationExecutor,
                                Duration timeout, DatadogMetricsServiceInterface metricsService) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter is required");
        this.isolationExecutor = Objects.requireNonNull(isolationExecutor, "isolationExecutor is required");
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
        this.metricsService = metricsService; // May be null
    }

    public PageResult execute(WorkUnit unit) {
        long startTime = System.currentTimeMillis();
        MDC.put("documentId", unit.getDocumentId());
        try {
            PageResult result = doExecute(unit, startTime);
            recordMetrics(result);
            return result;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure executing {}: {}", unit.label(), e.getMessage(), e);
            PageResult result = PageResult.failure(unit, ErrorKind.INTERNAL_ERROR, describe(e), elapsed(startTime));
            recordMetrics(result);
            return result;
        } finally {
            MDC.remove("documentId");
        }
    }

    private PageResult doExecute(WorkUnit unit, long startTime) {
        String methodVersion = provider.methodVersion();

        String fingerprint;
        try {
            fingerprint = fingerprinter.fingerprint(unit.getContentRef(), methodVersion);
        } catch (IOException e) {
            logger.warn("Cannot read page content for {}: {}", unit.label(), e.getMessage());
            return PageResult.failure(unit, ErrorKind.INTERNAL_ERROR,
                    "Cannot read page content: " + e.getMessage(), elapsed(startTime));
        }

        Optional<CacheEntry> cached = cache.lookup(fingerprint);
        if (metricsService != null) {
            metricsService.recordCacheLookup(cached.isPresent());
        }
        if (cached.isPresent()) {
            logger.debug("Cache hit for {}", unit.label());
            return PageResult.success(unit, cached.get().getResult(), true, elapsed(startTime));
        }

        PageAnalysis analysis;
        Future<PageAnalysis> future = null;
        try {
            PromptContext context = new PromptContext(unit.getDocumentId(), unit.getPageNumber());
            future = isolationExecutor.submit(() -> provider.analyze(unit.getContentRef(), context));
            analysis = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Analysis of {} timed out after {}ms", unit.label(), timeout.toMillis());
            return PageResult.failure(unit, ErrorKind.TIMEOUT,
                    "Analysis timed out after " + timeout.toMillis() + "ms", elapsed(startTime));
        } catch (ExecutionException e) {
            return providerFailure(unit, e.getCause(), startTime);
        } catch (InterruptedException e) {
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            return PageResult.failure(unit, ErrorKind.INTERNAL_ERROR, "Interrupted while awaiting analysis",
                    elapsed(startTime));
        } catch (RejectedExecutionException e) {
            logger.error("Isolation pool rejected {}: {}", unit.label(), e.getMessage());
            return PageResult.failure(unit, ErrorKind.INTERNAL_ERROR, describe(e), elapsed(startTime));
        }

        if (analysis == null) {
            return PageResult.failure(unit, ErrorKind.PARSE_ERROR, "Provider returned no analysis",
                    elapsed(startTime));
        }

        cache.store(fingerprint, new CacheEntry(fingerprint, methodVersion, unit.label(), analysis));
        return PageResult.success(unit, analysis, false, elapsed(startTime));
    }

    private PageResult providerFailure(WorkUnit unit, Throwable cause, long startTime) {
        ErrorKind kind;
        if (cause instanceof TimeoutException) {
            kind = ErrorKind.TIMEOUT;
        } else if (cause instanceof AnalysisParseException) {
            kind = ErrorKind.PARSE_ERROR;
        } else if (cause instanceof IOException || cause instanceof RuntimeException) {
            kind = ErrorKind.PROVIDER_ERROR;
        } else {
            kind = ErrorKind.INTERNAL_ERROR;
        }
        logger.warn("Analysis of {} failed with {}: {}", unit.label(), kind, cause != null ? cause.getMessage() : null);
        return PageResult.failure(unit, kind, describe(cause), elapsed(startTime));
    }

    private void recordMetrics(PageResult result) {
        if (metricsService == null) {
            return;
        }
        if (result.isSuccess()) {
            metricsService.recordPageSuccess(result.getDurationMs(), result.isFromCache());
        } else {
            metricsService.recordPageFailure(result.getErrorKind().name());
        }
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
