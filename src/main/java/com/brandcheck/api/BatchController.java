package com.brandcheck.api;

import com.brandcheck.processing.BatchOrchestrator;
import com.brandcheck.processing.model.BatchOptions;
import com.brandcheck.processing.model.BatchReport;
import com.brandcheck.shared.dto.BatchRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs a batch synchronously over HTTP.
 * Answers 200 when every document passed and 422 otherwise, mirroring the batch exit status.
 */
@RestController
@RequestMapping("/api/batches")
@Tag(name = "Batches", description = "Batch brand validation")
public class BatchController {

    private static final Logger logger = LoggerFactory.getLogger(BatchController.class);

    private final BatchOrchestrator batchOrchestrator;
    private final int defaultConcurrency;
    private final boolean defaultCacheEnabled;
    private final double defaultPassThreshold;
    private final List<String> defaultOutputFormats;

    public BatchController(
            BatchOrchestrator batchOrchestrator,
            @Value("${brandcheck.batch.concurrency:5}") int defaultConcurrency,
            @Value("${brandcheck.batch.cache-enabled:true}") boolean defaultCacheEnabled,
            @Value("${brandcheck.batch.pass-threshold:8.0}") double defaultPassThreshold,
            @Value("${brandcheck.batch.output-formats:json}") List<String> defaultOutputFormats) {
        this.batchOrchestrator = batchOrchestrator;
        this.defaultConcurrency = defaultConcurrency;
        this.defaultCacheEnabled = defaultCacheEnabled;
        this.defaultPassThreshold = defaultPassThreshold;
        this.defaultOutputFormats = defaultOutputFormats;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Validate a batch of documents",
               description = "Blocks until every page is analyzed. 200 when all documents passed, 422 otherwise.")
    public ResponseEntity<BatchReport> runBatch(@Valid @RequestBody BatchRequest request) {
        BatchOptions options = new BatchOptions(
                request.getConcurrency() != null ? request.getConcurrency() : defaultConcurrency,
                request.getCacheEnabled() != null ? request.getCacheEnabled() : defaultCacheEnabled,
                request.getOutputFormats() != null ? request.getOutputFormats() : defaultOutputFormats,
                request.getPassThreshold() != null ? request.getPassThreshold() : defaultPassThreshold);
        List<Path> documents = request.getDocumentPaths().stream()
                .map(Paths::get)
                .collect(Collectors.toList());

        logger.info("Batch requested: documents={}, options={}", documents.size(), options);
        BatchReport report = batchOrchestrator.run(documents, options);

        HttpStatus status = report.isAllPassed() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(report);
    }
}
