package com.example.tagsync.config;

import com.example.tagsync.model.OutcomeKind;
import com.example.tagsync.model.SyncPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the sync pipelines.
 *
 * Key metrics:
 * - sync.preload.time        → batch load of local tracks
 * - sync.batch.time          → whole search/apply/artwork batch (tag phase)
 * - sync.item.outcome        → per-item outcomes (tags phase, kind)
 * - sync.rate_limit.signals  → throttling responses seen from the provider
 * - sync.artwork.cache.*     → artwork cache hits/misses
 */
@Component
@Getter
public class SyncMetrics {

    private final Timer preloadTimer;
    private final Map<SyncPhase, Timer> batchTimers = new EnumMap<>(SyncPhase.class);
    private final Map<SyncPhase, Map<OutcomeKind, Counter>> outcomeCounters = new EnumMap<>(SyncPhase.class);
    private final Counter rateLimitSignalsCounter;
    private final Counter artworkCacheHitsCounter;
    private final Counter artworkCacheMissesCounter;

    public SyncMetrics(MeterRegistry registry) {
        this.preloadTimer = Timer.builder("sync.preload.time")
                .description("Batch load of local tracks (single query)")
                .register(registry);

        for (SyncPhase phase : SyncPhase.values()) {
            batchTimers.put(phase, Timer.builder("sync.batch.time")
                    .description("End-to-end batch time")
                    .tag("phase", phase.tag())
                    .register(registry));

            Map<OutcomeKind, Counter> byKind = new EnumMap<>(OutcomeKind.class);
            for (OutcomeKind kind : OutcomeKind.values()) {
                byKind.put(kind, Counter.builder("sync.item.outcome")
                        .description("Per-item batch outcomes")
                        .tag("phase", phase.tag())
                        .tag("kind", kind.name().toLowerCase())
                        .register(registry));
            }
            outcomeCounters.put(phase, byKind);
        }

        this.rateLimitSignalsCounter = Counter.builder("sync.rate_limit.signals")
                .description("Throttling responses received from the provider")
                .register(registry);

        this.artworkCacheHitsCounter = Counter.builder("sync.artwork.cache.hits")
                .description("Artwork served from cache")
                .register(registry);

        this.artworkCacheMissesCounter = Counter.builder("sync.artwork.cache.misses")
                .description("Artwork downloaded from the provider")
                .register(registry);
    }

    public void recordPreloadTime(long millis) {
        preloadTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordBatchTime(SyncPhase phase, long millis) {
        batchTimers.get(phase).record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementOutcome(SyncPhase phase, OutcomeKind kind) {
        outcomeCounters.get(phase).get(kind).increment();
    }

    public double outcomeCount(SyncPhase phase, OutcomeKind kind) {
        return outcomeCounters.get(phase).get(kind).count();
    }

    public void incrementRateLimitSignals() {
        rateLimitSignalsCounter.increment();
    }

    public void incrementArtworkCacheHit() {
        artworkCacheHitsCounter.increment();
    }

    public void incrementArtworkCacheMiss() {
        artworkCacheMissesCounter.increment();
    }
}
