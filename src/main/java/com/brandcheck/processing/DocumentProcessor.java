package com.brandcheck.processing;

import com.brandcheck.processing.model.DocumentVerdict;
import com.brandcheck.processing.model.ErrorKind;
import com.brandcheck.processing.model.PageImage;
import com.brandcheck.processing.model.PageResult;
import com.brandcheck.processing.model.WorkUnit;
import com.brandcheck.processing.progress.ProgressTracker;
import com.brandcheck.processing.rendering.DocumentRasterizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Validates one document: rasterizes it, runs every page through the batch's shared limiter and
 * folds the page results into a {@link DocumentVerdict}.
 * A failing page never fails the document; a document that cannot be rasterized gets an
 * unprocessable verdict instead of an exception.
 */
@Service
public class DocumentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentProcessor.class);

    private final DocumentRasterizer rasterizer;

    public DocumentProcessor(DocumentRasterizer rasterizer) {
        this.rasterizer = rasterizer;
    }

    /**
     * Blocking variant of {@link #submit}.
     */
    public DocumentVerdict process(Path document, BatchContext context) {
        return submit(document, context).join();
    }

    /**
     * Rasterizes {@code document} on the calling thread and schedules its pages.
     *
     * @return future completed with the verdict once every page has resolved; never completes exceptionally
     */
    public CompletableFuture<DocumentVerdict> submit(Path document, BatchContext context) {
        String documentId = documentId(document);
        MDC.put("documentId", documentId);
        try {
            List<PageImage> pages;
            try {
                Path pageDir = Files.createTempDirectory(context.getWorkDir(), "doc-");
                pages = rasterizer.rasterize(document, pageDir);
            } catch (IOException e) {
                return unprocessable(document, documentId, e.getMessage(), context);
            } catch (RuntimeException e) {
                logger.error("Rasterizer failed unexpectedly on {}", documentId, e);
                return unprocessable(document, documentId, e.toString(), context);
            }

            logger.info("Document {} rasterized into {} page(s)", documentId, pages.size());
            List<CompletableFuture<PageResult>> pageFutures = new ArrayList<>(pages.size());
            for (PageImage page : pages) {
                pageFutures.add(schedule(WorkUnit.of(documentId, page), context));
            }

            double passThreshold = context.getOptions().getPassThreshold();
            return CompletableFuture.allOf(pageFutures.toArray(new CompletableFuture[0]))
                    .thenApply(ignored -> {
                        List<PageResult> results = new ArrayList<>(pageFutures.size());
                        for (CompletableFuture<PageResult> future : pageFutures) {
                            results.add(future.join());
                        }
                        DocumentVerdict verdict = VerdictAggregator.aggregate(documentId, document.toString(),
                                results, passThreshold);
                        logger.info("Document {} verdict: score={} grade={} passed={} failedPages={}",
                                documentId, String.format("%.2f", verdict.getAggregateScore()),
                                verdict.getGrade(), verdict.isPassed(), verdict.getFailedPages());
                        return verdict;
                    });
        } finally {
            MDC.remove("documentId");
        }
    }

    private static CompletableFuture<DocumentVerdict> unprocessable(Path document, String documentId,
                                                                   String reason, BatchContext context) {
        logger.warn("Document {} is unprocessable: {}", documentId, reason);
        context.getProgressTracker().fail(documentId + " - " + ErrorKind.RASTERIZATION_ERROR);
        return CompletableFuture.completedFuture(DocumentVerdict.unprocessable(documentId,
                document.toString(), ErrorKind.RASTERIZATION_ERROR + ": " + reason));
    }

    private CompletableFuture<PageResult> schedule(WorkUnit unit, BatchContext context) {
        ProgressTracker tracker = context.getProgressTracker();
        String runId = context.getRunId();
        return context.getLimiter()
                .run(() -> {
                    MDC.put("runId", runId);
                    try {
                        return context.getUnitExecutor().execute(unit);
                    } finally {
                        MDC.remove("runId");
                    }
                })
                .exceptionally(t -> {
                    logger.error("Unit {} escaped the executor: {}", unit.label(), t.getMessage(), t);
                    return PageResult.failure(unit, ErrorKind.INTERNAL_ERROR, String.valueOf(t.getMessage()), 0L);
                })
                .thenApply(result -> {
                    if (result.isSuccess()) {
                        tracker.update(1, unit.label(), result.isFromCache());
                    } else {
                        tracker.fail(unit.label() + " - " + result.getErrorKind() + ": " + result.getErrorMessage());
                    }
                    return result;
                });
    }

    static String documentId(Path document) {
        Path fileName = document.getFileName();
        return fileName != null ? fileName.toString() : document.toString();
    }
}
