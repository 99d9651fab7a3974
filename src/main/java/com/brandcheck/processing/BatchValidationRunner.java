package com.brandcheck.processing;

import com.brandcheck.processing.model.BatchOptions;
import com.brandcheck.processing.model.BatchReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates the documents listed in {@code brandcheck.batch.documents} at startup.
 * Non-option command line arguments are appended to that list. The exit code is 0 when every
 * document passed and 1 otherwise.
 */
@Component
@ConditionalOnProperty(name = "brandcheck.batch.enabled", havingValue = "true")
public class BatchValidationRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(BatchValidationRunner.class);

    private final BatchOrchestrator batchOrchestrator;
    private final List<String> documents;
    private final BatchOptions options;
    private volatile int exitCode = 1;

    public BatchValidationRunner(
            BatchOrchestrator batchOrchestrator,
            @Value("${brandcheck.batch.documents:}") List<String> documents,
            @Value("${brandcheck.batch.concurrency:5}") int concurrency,
            @Value("${brandcheck.batch.cache-enabled:true}") boolean cacheEnabled,
            @Value("${brandcheck.batch.output-formats:json}") List<String> outputFormats,
            @Value("${brandcheck.batch.pass-threshold:8.0}") double passThreshold) {
        this.batchOrchestrator = batchOrchestrator;
        this.documents = documents;
        this.options = new BatchOptions(concurrency, cacheEnabled, outputFormats, passThreshold);
    }

    @Override
    public void run(ApplicationArguments args) {
        List<Path> paths = new ArrayList<>();
        for (String document : documents) {
            if (!document.isBlank()) {
                paths.add(Paths.get(document.trim()));
            }
        }
        for (String arg : args.getNonOptionArgs()) {
            paths.add(Paths.get(arg));
        }

        if (paths.isEmpty()) {
            logger.warn("Batch mode enabled but no documents configured (brandcheck.batch.documents)");
            exitCode = 0;
            return;
        }

        BatchReport report = batchOrchestrator.run(paths, options);
        exitCode = report.exitCode();
        logger.info("Batch {} finished: {}/{} documents passed, exit code {}",
                report.getRunId(), report.getPassedDocuments(), report.getTotalDocuments(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
