package com.brandcheck.processing;

import com.brandcheck.processing.model.BatchOptions;
import com.brandcheck.processing.model.BatchReport;
import com.brandcheck.processing.model.DocumentVerdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchValidationRunnerTest {

    @Mock
    private BatchOrchestrator batchOrchestrator;

    private static BatchReport report(boolean passed) {
        DocumentVerdict verdict = new DocumentVerdict("a.pdf", "a.pdf", 1, 1, 0, passed ? 9.0 : 5.0,
                9.0, passed ? "A" : "F", List.of(), passed, null, List.of());
        return VerdictAggregator.buildReport("run-1", Instant.now(), List.of(verdict), 10L);
    }

    @SuppressWarnings("unchecked")
    @Test
    void testRunsConfiguredDocumentsAndCommandLineArguments() throws Exception {
        // Given
        when(batchOrchestrator.run(anyList(), any(BatchOptions.class))).thenReturn(report(true));
        BatchValidationRunner runner = new BatchValidationRunner(batchOrchestrator,
                List.of("docs/a.pdf", " "), 3, true, List.of("json"), 8.0);

        // When
        runner.run(new DefaultApplicationArguments("--spring.profiles.active=batch", "docs/b.pdf"));

        // Then
        ArgumentCaptor<List<Path>> paths = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<BatchOptions> options = ArgumentCaptor.forClass(BatchOptions.class);
        verify(batchOrchestrator).run(paths.capture(), options.capture());
        assertThat(paths.getValue()).containsExactly(Paths.get("docs/a.pdf"), Paths.get("docs/b.pdf"));
        assertThat(options.getValue().getConcurrency()).isEqualTo(3);
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void testFailedDocumentGivesNonZeroExitCode() throws Exception {
        when(batchOrchestrator.run(anyList(), any(BatchOptions.class))).thenReturn(report(false));
        BatchValidationRunner runner = new BatchValidationRunner(batchOrchestrator,
                List.of("docs/a.pdf"), 5, true, List.of("json"), 8.0);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void testNothingConfiguredExitsCleanly() throws Exception {
        BatchValidationRunner runner = new BatchValidationRunner(batchOrchestrator,
                List.of(), 5, true, List.of("json"), 8.0);

        runner.run(new DefaultApplicationArguments());

        verify(batchOrchestrator, never()).run(anyList(), any(BatchOptions.class));
        assertThat(runner.getExitCode()).isZero();
    }
}
