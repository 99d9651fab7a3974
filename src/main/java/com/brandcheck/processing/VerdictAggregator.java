package com.brandcheck.processing;

import com.brandcheck.processing.model.BatchReport;
import com.brandcheck.processing.model.DocumentVerdict;
import com.brandcheck.processing.model.PageResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds page results into document verdicts and verdicts into a batch report.
 * Pure functions: results are sorted before any arithmetic, so the outcome does not depend on
 * the order in which pages completed.
 */
public final class VerdictAggregator {

    private VerdictAggregator() {
    }

    /**
     * Builds the verdict of one document. Failed pages are counted but excluded from the means;
     * a document without any successful page scores 0 and does not pass.
     */
    public static DocumentVerdict aggregate(String documentId, String documentPath,
                                            List<PageResult> pageResults, double passThreshold) {
        List<PageResult> ordered = new ArrayList<>(pageResults);
        ordered.sort(Comparator.comparingInt(PageResult::getPageNumber));

        int successful = 0;
        double scoreSum = 0.0;
        double brandSum = 0.0;
        List<String> violations = new ArrayList<>();
        for (PageResult result : ordered) {
            if (!result.isSuccess()) {
                continue;
            }
            successful++;
            scoreSum += result.getScore();
            brandSum += result.getBrandComplianceScore();
            for (String violation : result.getCriticalViolations()) {
                violations.add("Page " + result.getPageNumber() + ": " + violation);
            }
        }

        int failed = ordered.size() - successful;
        double aggregateScore = successful > 0 ? scoreSum / successful : 0.0;
        double brandScore = successful > 0 ? brandSum / successful : 0.0;
        boolean passed = successful > 0 && violations.isEmpty() && aggregateScore >= passThreshold;

        return new DocumentVerdict(documentId, documentPath, ordered.size(), successful, failed,
                aggregateScore, brandScore, grade(aggregateScore), violations, passed, null, ordered);
    }

    /**
     * Letter grade for a 0-10 score.
     */
    public static String grade(double score) {
        if (score >= 9.5) {
            return "A+";
        }
        if (score >= 9.0) {
            return "A";
        }
        if (score >= 8.0) {
            return "B";
        }
        if (score >= 7.0) {
            return "C";
        }
        if (score >= 6.0) {
            return "D";
        }
        return "F";
    }

    /**
     * Summarizes a finished run. Documents are listed by id; ties keep submission order.
     */
    public static BatchReport buildReport(String runId, Instant generatedAt, List<DocumentVerdict> verdicts,
                                          long wallClockDurationMs) {
        List<DocumentVerdict> ordered = new ArrayList<>(verdicts);
        ordered.sort(Comparator.comparing(DocumentVerdict::getDocumentId));

        int passed = 0;
        int unprocessable = 0;
        int belowThreshold = 0;
        int totalPages = 0;
        int cachedPages = 0;
        int analyzedPages = 0;
        int failedPages = 0;
        int scoredDocuments = 0;
        double scoreSum = 0.0;

        for (DocumentVerdict verdict : ordered) {
            if (verdict.isPassed()) {
                passed++;
            } else if (verdict.isUnprocessable()) {
                unprocessable++;
            } else {
                belowThreshold++;
            }
            if (!verdict.isUnprocessable()) {
                scoredDocuments++;
                scoreSum += verdict.getAggregateScore();
            }
            for (PageResult page : verdict.getPageResults()) {
                totalPages++;
                if (!page.isSuccess()) {
                    failedPages++;
                } else if (page.isFromCache()) {
                    cachedPages++;
                } else {
                    analyzedPages++;
                }
            }
        }

        double averageScore = scoredDocuments > 0 ? scoreSum / scoredDocuments : 0.0;
        double cacheHitRate = totalPages > 0 ? (cachedPages * 100.0) / totalPages : 0.0;

        return new BatchReport(runId, generatedAt, ordered, passed, unprocessable, belowThreshold,
                totalPages, cachedPages, analyzedPages, failedPages, averageScore,
                wallClockDurationMs, cacheHitRate);
    }
}
