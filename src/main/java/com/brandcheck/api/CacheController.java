package com.brandcheck.api;

import com.brandcheck.processing.cache.CacheStatistics;
import com.brandcheck.processing.cache.FileAnalysisCache;
import com.brandcheck.shared.dto.CacheStatsResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/cache")
@Tag(name = "Cache", description = "Analysis cache inspection and reset")
public class CacheController {

    private final FileAnalysisCache analysisCache;

    public CacheController(FileAnalysisCache analysisCache) {
        this.analysisCache = analysisCache;
    }

    @GetMapping("/stats")
    @Operation(summary = "Cache statistics", description = "Session hit/miss counters and on-disk usage")
    public ResponseEntity<CacheStatsResponse> stats() throws IOException {
        FileAnalysisCache.DirectoryUsage usage = analysisCache.directoryUsage();
        CacheStatistics statistics = analysisCache.statistics();
        return ResponseEntity.ok(new CacheStatsResponse(
                analysisCache.getCacheDir().toString(),
                usage.getEntryCount(), usage.getTotalBytes(),
                statistics.getHits(), statistics.getMisses(), statistics.getStores(), statistics.getErrors(),
                statistics.getHitRate()));
    }

    @DeleteMapping
    @Operation(summary = "Clear the cache", description = "Deletes every stored analysis; the next run re-analyzes all pages")
    public ResponseEntity<Map<String, Object>> clear() throws IOException {
        int deleted = analysisCache.clear();
        Map<String, Object> response = new HashMap<>();
        response.put("deleted", deleted);
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(response);
    }
}
