package com.brandcheck.processing;

import com.brandcheck.TestPdfFactory;
import com.brandcheck.processing.cache.ContentFingerprinter;
import com.brandcheck.processing.cache.FileAnalysisCache;
import com.brandcheck.processing.model.BatchOptions;
import com.brandcheck.processing.model.BatchReport;
import com.brandcheck.processing.model.DocumentVerdict;
import com.brandcheck.processing.model.ErrorKind;
import com.brandcheck.processing.model.PageResult;
import com.brandcheck.processing.rendering.DocumentRasterizer;
import com.brandcheck.processing.rendering.DocumentValidator;
import com.brandcheck.processing.rendering.PdfBoxDocumentRasterizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for BatchOrchestrator with a fake rasterizer and provider and a real file cache.
 */
class BatchOrchestratorTest {

    @TempDir
    Path tempDir;

    private ExecutorService unitPool;
    private ExecutorService isolationPool;
    private ObjectMapper objectMapper;
    private FileAnalysisCache cache;
    private FakeDocumentRasterizer rasterizer;

    @BeforeEach
    void setUp() {
        unitPool = Executors.newCachedThreadPool();
        isolationPool = Executors.newCachedThreadPool();
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        cache = new FileAnalysisCache(tempDir.resolve("cache").toString(), objectMapper);
        rasterizer = new FakeDocumentRasterizer()
                .withDocument("alpha.pdf", 3)
                .withDocument("beta.pdf", 3);
    }

    @AfterEach
    void tearDown() {
        unitPool.shutdownNow();
        isolationPool.shutdownNow();
    }

    private BatchOrchestrator orchestrator(FakePageAnalysisProvider provider) {
        return orchestrator(provider, rasterizer, 5L);
    }

    private BatchOrchestrator orchestrator(FakePageAnalysisProvider provider, DocumentRasterizer documentRasterizer,
                                           long pageTimeoutSeconds) {
        return new BatchOrchestrator(
                new DocumentProcessor(documentRasterizer), documentRasterizer, provider, cache, new ContentFingerprinter(),
                new BatchReportWriter(tempDir.resolve("reports").toString(), objectMapper),
                unitPool, isolationPool, pageTimeoutSeconds, 50L, tempDir.resolve("work").toString(), null, null);
    }

    private List<Path> documents(String... names) {
        return Stream.of(names).map(tempDir::resolve).collect(Collectors.toList());
    }

    private static BatchOptions options(int concurrency, boolean cacheEnabled) {
        return new BatchOptions(concurrency, cacheEnabled, List.of("json"), 8.0);
    }

    @Test
    void testFirstRunAnalyzesEveryPage() {
        // Given: 2 documents of 3 pages, every page scores 9.0
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0);

        // When
        BatchReport report = orchestrator(provider).run(documents("alpha.pdf", "beta.pdf"), options(5, true));

        // Then
        assertThat(report.getTotalDocuments()).isEqualTo(2);
        assertThat(report.getPassedDocuments()).isEqualTo(2);
        assertThat(report.getTotalPages()).isEqualTo(6);
        assertThat(report.getAnalyzedPages()).isEqualTo(6);
        assertThat(report.getAverageScore()).isCloseTo(9.0, within(1e-9));
        assertThat(report.getCacheHitRate()).isZero();
        assertThat(report.exitCode()).isZero();
        assertThat(provider.calls()).isEqualTo(6);
    }

    @Test
    void testRerunIsServedEntirelyFromCache() {
        // Given: a first run that populated the cache
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0);
        BatchOrchestrator orchestrator = orchestrator(provider);
        BatchReport first = orchestrator.run(documents("alpha.pdf", "beta.pdf"), options(5, true));

        // When: the same batch runs again
        BatchReport second = orchestrator.run(documents("alpha.pdf", "beta.pdf"), options(5, true));

        // Then: no new provider calls and identical scores
        assertThat(provider.calls()).isEqualTo(6);
        assertThat(second.getCacheHitRate()).isCloseTo(100.0, within(1e-9));
        assertThat(second.getCachedPages()).isEqualTo(6);
        assertThat(second.getAverageScore()).isEqualTo(first.getAverageScore());
        assertThat(second.getDocuments()).extracting(DocumentVerdict::getAggregateScore)
                .containsExactlyElementsOf(first.getDocuments().stream()
                        .map(DocumentVerdict::getAggregateScore).collect(Collectors.toList()));
    }

    @Test
    void testDisabledCacheCallsProviderEveryRun() {
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0);
        BatchOrchestrator orchestrator = orchestrator(provider);

        orchestrator.run(documents("alpha.pdf"), options(5, false));
        BatchReport second = orchestrator.run(documents("alpha.pdf"), options(5, false));

        assertThat(provider.calls()).isEqualTo(6);
        assertThat(second.getCacheHitRate()).isZero();
    }

    @Test
    void testOneFailingPageOutOfSix() {
        // Given: page 2 of beta.pdf always fails
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0)
                .on("beta.pdf", 2, (page, ctx) -> {
                    throw new IOException("provider returned 500");
                });

        // When
        BatchReport report = orchestrator(provider).run(documents("alpha.pdf", "beta.pdf"), options(5, true));

        // Then: the batch completes and beta is scored on its remaining pages
        DocumentVerdict beta = report.getDocuments().get(1);
        assertThat(beta.getDocumentId()).isEqualTo("beta.pdf");
        assertThat(beta.getFailedPages()).isEqualTo(1);
        assertThat(beta.getSuccessfulPages()).isEqualTo(2);
        assertThat(beta.getAggregateScore()).isCloseTo(9.0, within(1e-9));
        assertThat(report.getFailedPages()).isEqualTo(1);
        assertThat(report.getTotalPages()).isEqualTo(6);
    }

    @Test
    void testConcurrencyLimitHoldsAcrossDocuments() {
        rasterizer.withDocument("gamma.pdf", 4);
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0, 30L);

        BatchReport report = orchestrator(provider).run(documents("alpha.pdf", "beta.pdf", "gamma.pdf"), options(2, true));

        assertThat(report.getTotalPages()).isEqualTo(10);
        assertThat(provider.peakActive()).isLessThanOrEqualTo(2);
    }

    @Test
    void testUnprocessableAndBelowThresholdAreReportedSeparately() {
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0)
                .on("beta.pdf", 1, (page, ctx) -> FakePageAnalysisProvider.scored(4.0))
                .on("beta.pdf", 2, (page, ctx) -> FakePageAnalysisProvider.scored(4.0))
                .on("beta.pdf", 3, (page, ctx) -> FakePageAnalysisProvider.scored(4.0));

        BatchReport report = orchestrator(provider).run(documents("alpha.pdf", "beta.pdf", "broken.pdf"), options(3, true));

        assertThat(report.getPassedDocuments()).isEqualTo(1);
        assertThat(report.getBelowThresholdDocuments()).isEqualTo(1);
        assertThat(report.getUnprocessableDocuments()).isEqualTo(1);
        assertThat(report.getDocuments().get(2).getError()).contains("Not a PDF");
        assertThat(report.exitCode()).isEqualTo(1);
    }

    @Test
    void testJsonReportWrittenAndWorkDirectoryRemoved() throws IOException {
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0);
        BatchOptions options = new BatchOptions(5, true, List.of("json", "html"), 8.0);

        BatchReport report = orchestrator(provider).run(documents("alpha.pdf"), options);

        List<Path> reports;
        try (Stream<Path> files = Files.list(tempDir.resolve("reports"))) {
            reports = files.collect(Collectors.toList());
        }
        assertThat(reports).hasSize(1);
        assertThat(reports.get(0).getFileName().toString()).startsWith("batch-report-").endsWith(".json");
        JsonNode json = objectMapper.readTree(reports.get(0).toFile());
        assertThat(json.get("runId").asText()).isEqualTo(report.getRunId());
        assertThat(json.get("totalPages").asInt()).isEqualTo(3);

        try (Stream<Path> leftovers = Files.list(tempDir.resolve("work"))) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void testRasterizerCrashIsContainedToItsDocument() {
        // Given: the rasterizer throws an unchecked exception for beta.pdf
        rasterizer.crashingOn("beta.pdf", new IllegalStateException("corrupt xref"));
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0);

        // When
        BatchReport report = orchestrator(provider).run(documents("alpha.pdf", "beta.pdf"), options(5, true));

        // Then: alpha is still validated and beta is reported as unprocessable
        assertThat(report.getTotalDocuments()).isEqualTo(2);
        assertThat(report.getPassedDocuments()).isEqualTo(1);
        assertThat(report.getUnprocessableDocuments()).isEqualTo(1);
        assertThat(report.getDocuments().get(1).getError()).contains("corrupt xref");
        assertThat(report.exitCode()).isEqualTo(1);
    }

    @Test
    void testPathWithoutFileNameIsUnprocessable() throws IOException {
        // Given: a real PDF next to a path that has no file name
        Path good = TestPdfFactory.writePdf(tempDir.resolve("good.pdf"), "Good", 1);
        DocumentRasterizer pdfBox = new PdfBoxDocumentRasterizer(72f, new DocumentValidator(5));
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0);

        // When
        BatchReport report = orchestrator(provider, pdfBox, 5L).run(List.of(good, Paths.get("/")), options(2, true));

        // Then
        assertThat(report.getTotalDocuments()).isEqualTo(2);
        assertThat(report.getPassedDocuments()).isEqualTo(1);
        assertThat(report.getUnprocessableDocuments()).isEqualTo(1);
        DocumentVerdict root = report.getDocuments().stream()
                .filter(DocumentVerdict::isUnprocessable).findFirst().orElseThrow();
        assertThat(root.getError()).startsWith("RASTERIZATION_ERROR");
    }

    @Test
    void testTimedOutPageReleasesItsSlot() {
        // Given: one slot, and page 1 of alpha.pdf hangs until it is interrupted
        FakePageAnalysisProvider provider = new FakePageAnalysisProvider(9.0)
                .on("alpha.pdf", 1, (page, ctx) -> {
                    try {
                        Thread.sleep(TimeUnit.MINUTES.toMillis(5));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    throw new IOException("abandoned");
                });

        // When
        long start = System.nanoTime();
        BatchReport report = orchestrator(provider, rasterizer, 1L).run(documents("alpha.pdf"), options(1, false));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Then: the sibling pages ran after the deadline instead of waiting for the hung call
        DocumentVerdict alpha = report.getDocuments().get(0);
        assertThat(alpha.getPageResults()).extracting(PageResult::getErrorKind)
                .containsExactly(ErrorKind.TIMEOUT, null, null);
        assertThat(alpha.getSuccessfulPages()).isEqualTo(2);
        assertThat(elapsedMs).isLessThan(5000);
    }
}
