package com.brandcheck.processing;

import com.brandcheck.processing.model.BatchReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes the JSON form of a {@link BatchReport} to {@code brandcheck.batch.report-dir}.
 */
@Component
public class BatchReportWriter {

    public static final String JSON_FORMAT = "json";

    private static final Logger logger = LoggerFactory.getLogger(BatchReportWriter.class);

    private final Path reportDir;
    private final ObjectMapper objectMapper;

    public BatchReportWriter(
            @Value("${brandcheck.batch.report-dir:batch-reports}") String reportDir,
            ObjectMapper objectMapper) {
        this.reportDir = Paths.get(reportDir).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    /**
     * @return path of the written file, named {@code batch-report-<timestamp>.json}
     * @throws IOException if the directory or the file cannot be written
     */
    public Path writeJson(BatchReport report) throws IOException {
        Files.createDirectories(reportDir);
        String timestamp = report.getGeneratedAt().toString().replace(':', '-').replace('.', '-');
        Path target = reportDir.resolve("batch-report-" + timestamp + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        logger.info("JSON report written: {}", target);
        return target;
    }

    public Path getReportDir() {
        return reportDir;
    }
}
