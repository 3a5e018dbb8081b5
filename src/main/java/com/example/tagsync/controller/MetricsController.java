package com.example.tagsync.controller;

import com.example.tagsync.config.SyncMetrics;
import com.example.tagsync.model.OutcomeKind;
import com.example.tagsync.model.SyncPhase;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for a sync metrics summary.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final SyncMetrics syncMetrics;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        for (SyncPhase phase : SyncPhase.values()) {
            response.put(phase.tag(), getPhaseMetrics(phase));
        }
        response.put("preload", getTimerStats(syncMetrics.getPreloadTimer()));
        response.put("rateLimitSignals", (long) syncMetrics.getRateLimitSignalsCounter().count());
        response.put("artworkCache", getArtworkCacheMetrics());

        return response;
    }

    private Map<String, Object> getPhaseMetrics(SyncPhase phase) {
        Map<String, Object> metrics = new LinkedHashMap<>();

        double success = syncMetrics.outcomeCount(phase, OutcomeKind.SUCCESS);
        double failure = syncMetrics.outcomeCount(phase, OutcomeKind.FAILURE);
        double skipped = syncMetrics.outcomeCount(phase, OutcomeKind.SKIPPED);
        double total = success + failure + skipped;

        metrics.put("items", (long) total);
        metrics.put("success", (long) success);
        metrics.put("failure", (long) failure);
        metrics.put("skipped", (long) skipped);
        if (total > 0) {
            metrics.put("successRate", String.format("%.2f%%", (success / total) * 100));
        } else {
            metrics.put("successRate", "N/A");
        }
        metrics.put("batchTiming", getTimerStats(syncMetrics.getBatchTimers().get(phase)));

        return metrics;
    }

    private Map<String, Object> getArtworkCacheMetrics() {
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("hits", (long) syncMetrics.getArtworkCacheHitsCounter().count());
        cache.put("misses", (long) syncMetrics.getArtworkCacheMissesCounter().count());
        return cache;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
