package com.example.tagsync.service;

import com.example.tagsync.client.ArtworkFetcher;
import com.example.tagsync.client.MetadataClient;
import com.example.tagsync.config.SyncMetrics;
import com.example.tagsync.config.TraceContextManager;
import com.example.tagsync.exception.ProviderErrorKind;
import com.example.tagsync.exception.ProviderException;
import com.example.tagsync.exception.StoreException;
import com.example.tagsync.model.AppliedTags;
import com.example.tagsync.model.ApplyReport;
import com.example.tagsync.model.ArtworkReport;
import com.example.tagsync.model.BatchReport;
import com.example.tagsync.model.Candidate;
import com.example.tagsync.model.FoundArtwork;
import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.model.Outcome;
import com.example.tagsync.model.ProviderTrack;
import com.example.tagsync.model.SearchReport;
import com.example.tagsync.model.SyncPhase;
import com.example.tagsync.model.TrackCandidates;
import com.example.tagsync.model.TrackSelection;
import com.example.tagsync.model.TrackTags;
import com.example.tagsync.repository.TrackStore;
import com.example.tagsync.service.concurrency.ConcurrencyConfig;
import com.example.tagsync.service.concurrency.RateLimitMonitor;
import com.example.tagsync.service.orchestration.BatchCancellation;
import com.example.tagsync.service.orchestration.BatchRegistry;
import com.example.tagsync.service.orchestration.BatchRequest;
import com.example.tagsync.service.orchestration.TaskOrchestrator;
import com.example.tagsync.service.preload.TrackPreloadService;
import com.example.tagsync.service.progress.ProgressEmitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry points of the sync pipelines.
 *
 * Pipeline (all three):
 * 1. Preload  - all local tracks of the batch in one query
 * 2. Dispatch - one task per id under the batch's concurrency config
 * 3. Report   - outcomes in input order
 *
 * Search proposes provider candidates per track; apply fetches the chosen provider track,
 * downloads its artwork and writes the tags back to the library; the artwork batch stores only
 * the cover art of each track's best match.
 */
@Service
@Slf4j
public class MetadataSyncService {

    static final String REASON_NO_SELECTION = "no candidate selected";
    static final String REASON_NO_MATCH = "no match found";
    static final String REASON_NO_ARTWORK = "match has no artwork";

    private final TrackPreloadService preloadService;
    private final TaskOrchestrator orchestrator;
    private final MetadataClient metadataClient;
    private final ArtworkFetcher artworkFetcher;
    private final TrackStore trackStore;
    private final BatchRegistry batchRegistry;
    private final SyncMetrics metrics;
    private final ConcurrencyConfig searchConcurrency;
    private final ConcurrencyConfig applyConcurrency;
    private final RateLimitMonitor sharedMonitor;
    private final Clock clock;

    @Value("${app.sync.search.max-results:4}")
    private int maxResults = 4;

    @Value("${app.sync.search.min-score:0.25}")
    private double minScore = 0.25;

    @Value("${app.sync.apply.serialize-writes:true}")
    private boolean serializeWrites = true;

    @Value("${app.sync.rate-limit.shared:false}")
    private boolean sharedRateLimit = false;

    public MetadataSyncService(
            TrackPreloadService preloadService,
            TaskOrchestrator orchestrator,
            MetadataClient metadataClient,
            ArtworkFetcher artworkFetcher,
            TrackStore trackStore,
            BatchRegistry batchRegistry,
            SyncMetrics metrics,
            @Qualifier("searchConcurrency") ConcurrencyConfig searchConcurrency,
            @Qualifier("applyConcurrency") ConcurrencyConfig applyConcurrency,
            @Qualifier("sharedRateLimitMonitor") RateLimitMonitor sharedMonitor,
            Clock clock) {
        this.preloadService = preloadService;
        this.orchestrator = orchestrator;
        this.metadataClient = metadataClient;
        this.artworkFetcher = artworkFetcher;
        this.trackStore = trackStore;
        this.batchRegistry = batchRegistry;
        this.metrics = metrics;
        this.searchConcurrency = searchConcurrency;
        this.applyConcurrency = applyConcurrency;
        this.sharedMonitor = sharedMonitor;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // SEARCH
    // ═══════════════════════════════════════════════════════════════

    public SearchReport searchCandidates(List<String> trackIds, ProgressEmitter emitter) {
        return searchCandidates(TraceContextManager.generateBatchId(), trackIds, emitter);
    }

    public SearchReport searchCandidates(String batchId, List<String> trackIds, ProgressEmitter emitter) {
        if (trackIds == null || trackIds.isEmpty()) {
            return SearchReport.of(BatchReport.empty(batchId));
        }
        if (trackIds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Track ids must not contain null");
        }

        String previousBatch = TraceContextManager.enterBatch(batchId);
        BatchCancellation cancellation = batchRegistry.register(batchId);
        long startTime = System.currentTimeMillis();
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("SEARCH START: {} tracks | max {} results, min score {}", trackIds.size(), maxResults, minScore);
            log.info("═══════════════════════════════════════════════════════════════");

            Map<String, LocalTrack> snapshot = preloadService.load(trackIds);

            BatchRequest<LocalTrack, TrackCandidates> request = BatchRequest.<LocalTrack, TrackCandidates>builder()
                    .batchId(batchId)
                    .phase(SyncPhase.SEARCHING)
                    .ids(List.copyOf(trackIds))
                    .snapshot(snapshot)
                    .config(searchConcurrency)
                    .monitor(monitorForBatch())
                    .operation((id, track) -> TrackCandidates.of(track,
                            metadataClient.search(track, maxResults, minScore)))
                    .emitter(emitterOrNone(emitter))
                    .cancellation(cancellation)
                    .build();

            SearchReport report = SearchReport.of(orchestrator.execute(request));

            long totalTime = System.currentTimeMillis() - startTime;
            metrics.recordBatchTime(SyncPhase.SEARCHING, totalTime);
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("SEARCH COMPLETE | Total: {}ms", totalTime);
            log.info("  With candidates: {} | Without: {} | Failures: {}",
                    report.withCandidates(), report.withoutCandidates(), report.report().failureCount());
            log.info("═══════════════════════════════════════════════════════════════");
            return report;
        } finally {
            batchRegistry.unregister(batchId);
            TraceContextManager.exitBatch(previousBatch);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // APPLY
    // ═══════════════════════════════════════════════════════════════

    public ApplyReport applySelections(List<TrackSelection> selections, ProgressEmitter emitter) {
        return applySelections(TraceContextManager.generateBatchId(), selections, emitter);
    }

    /**
     * Selections without a provider id are reported as skipped and never touch the provider.
     */
    public ApplyReport applySelections(String batchId, List<TrackSelection> selections, ProgressEmitter emitter) {
        if (selections == null || selections.isEmpty()) {
            return new ApplyReport(BatchReport.empty(batchId));
        }

        List<String> selectedIds = new ArrayList<>();
        Map<String, Long> providerIds = new HashMap<>();
        for (TrackSelection selection : selections) {
            if (isDispatchable(selection)) {
                selectedIds.add(selection.localTrackId());
                providerIds.putIfAbsent(selection.localTrackId(), selection.providerTrackId());
            }
        }

        String previousBatch = TraceContextManager.enterBatch(batchId);
        BatchCancellation cancellation = batchRegistry.register(batchId);
        long startTime = System.currentTimeMillis();
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("APPLY START: {} selections | {} with a provider track | serialized writes: {}",
                    selections.size(), selectedIds.size(), serializeWrites ? "ON" : "OFF");
            log.info("═══════════════════════════════════════════════════════════════");

            BatchReport<AppliedTags> dispatched = BatchReport.empty(batchId);
            if (!selectedIds.isEmpty()) {
                Map<String, LocalTrack> tracks = preloadService.load(selectedIds);
                Map<String, ApplyTarget> snapshot = new HashMap<>();
                tracks.forEach((id, track) -> snapshot.put(id, new ApplyTarget(track, providerIds.get(id))));

                Lock writeLock = serializeWrites ? new ReentrantLock() : null;
                BatchRequest<ApplyTarget, AppliedTags> request = BatchRequest.<ApplyTarget, AppliedTags>builder()
                        .batchId(batchId)
                        .phase(SyncPhase.APPLYING)
                        .ids(selectedIds)
                        .snapshot(Map.copyOf(snapshot))
                        .config(applyConcurrency)
                        .monitor(monitorForBatch())
                        .operation((id, target) -> applyOne(id, target, writeLock))
                        .emitter(emitterOrNone(emitter))
                        .cancellation(cancellation)
                        .build();
                dispatched = orchestrator.execute(request);
            }

            ApplyReport report = new ApplyReport(BatchReport.of(batchId,
                    mergeOutcomes(selections, dispatched), System.currentTimeMillis() - startTime));

            long totalTime = report.report().elapsedMs();
            metrics.recordBatchTime(SyncPhase.APPLYING, totalTime);
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("APPLY COMPLETE | Total: {}ms", totalTime);
            log.info("  Applied: {} | Failures: {} | Skipped: {}",
                    report.successCount(), report.failureCount(), report.report().skippedCount());
            log.info("═══════════════════════════════════════════════════════════════");
            return report;
        } finally {
            batchRegistry.unregister(batchId);
            TraceContextManager.exitBatch(previousBatch);
        }
    }

    private AppliedTags applyOne(String id, ApplyTarget target, Lock writeLock) throws Exception {
        ProviderTrack providerTrack = metadataClient.fetchTrack(target.providerTrackId());
        TrackTags tags = TrackTags.from(providerTrack).mergedWith(target.track());

        byte[] artwork = null;
        if (tags.artworkUrl() != null && !tags.artworkUrl().isBlank()) {
            try {
                artwork = artworkFetcher.download(tags.artworkUrl());
            } catch (Exception e) {
                log.warn("Artwork download failed for {} ({}), applying tags without it: {}",
                        id, tags.artworkUrl(), e.getMessage());
            }
        }

        if (writeLock != null) {
            writeLock.lock();
        }
        try {
            trackStore.persist(id, tags, artwork);
        } catch (RuntimeException e) {
            throw new StoreException("write failed: " + e.getMessage(), e);
        } finally {
            if (writeLock != null) {
                writeLock.unlock();
            }
        }

        log.debug("Applied provider track {} to {} (artwork: {})", providerTrack.id(), id, artwork != null);
        return new AppliedTags(id, providerTrack.id(), tags, artwork != null);
    }

    // ═══════════════════════════════════════════════════════════════
    // ARTWORK ONLY
    // ═══════════════════════════════════════════════════════════════

    public ArtworkReport findArtwork(List<String> trackIds, ProgressEmitter emitter) {
        return findArtwork(TraceContextManager.generateBatchId(), trackIds, emitter);
    }

    /**
     * Looks up the best provider match of every track and stores only its cover art.
     * Runs under the apply concurrency config; tags are never written.
     */
    public ArtworkReport findArtwork(String batchId, List<String> trackIds, ProgressEmitter emitter) {
        if (trackIds == null || trackIds.isEmpty()) {
            return new ArtworkReport(BatchReport.empty(batchId));
        }
        if (trackIds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Track ids must not contain null");
        }

        String previousBatch = TraceContextManager.enterBatch(batchId);
        BatchCancellation cancellation = batchRegistry.register(batchId);
        long startTime = System.currentTimeMillis();
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("ARTWORK START: {} tracks | min score {} | serialized writes: {}",
                    trackIds.size(), minScore, serializeWrites ? "ON" : "OFF");
            log.info("═══════════════════════════════════════════════════════════════");

            Map<String, LocalTrack> snapshot = preloadService.load(trackIds);

            Lock writeLock = serializeWrites ? new ReentrantLock() : null;
            BatchRequest<LocalTrack, FoundArtwork> request = BatchRequest.<LocalTrack, FoundArtwork>builder()
                    .batchId(batchId)
                    .phase(SyncPhase.ARTWORK)
                    .ids(List.copyOf(trackIds))
                    .snapshot(snapshot)
                    .config(applyConcurrency)
                    .monitor(monitorForBatch())
                    .operation((id, track) -> findArtworkFor(id, track, writeLock))
                    .emitter(emitterOrNone(emitter))
                    .cancellation(cancellation)
                    .build();

            ArtworkReport report = new ArtworkReport(orchestrator.execute(request));

            long totalTime = System.currentTimeMillis() - startTime;
            metrics.recordBatchTime(SyncPhase.ARTWORK, totalTime);
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("ARTWORK COMPLETE | Total: {}ms", totalTime);
            log.info("  Stored: {} | Failures: {} | Skipped: {}",
                    report.successCount(), report.failureCount(), report.report().skippedCount());
            log.info("═══════════════════════════════════════════════════════════════");
            return report;
        } finally {
            batchRegistry.unregister(batchId);
            TraceContextManager.exitBatch(previousBatch);
        }
    }

    private FoundArtwork findArtworkFor(String id, LocalTrack track, Lock writeLock) throws Exception {
        List<Candidate> matches = metadataClient.search(track, 1, minScore);
        if (matches.isEmpty()) {
            throw new ProviderException(ProviderErrorKind.NOT_FOUND, REASON_NO_MATCH);
        }
        Candidate best = matches.get(0);
        String artworkUrl = best.artworkUrl();
        if (artworkUrl == null || artworkUrl.isBlank()) {
            throw new ProviderException(ProviderErrorKind.NOT_FOUND, REASON_NO_ARTWORK);
        }

        byte[] artwork;
        try {
            artwork = artworkFetcher.download(artworkUrl);
        } catch (IOException e) {
            throw new IOException("artwork download failed: " + e.getMessage(), e);
        }

        if (writeLock != null) {
            writeLock.lock();
        }
        try {
            trackStore.persistArtwork(id, artwork, artworkUrl);
        } catch (RuntimeException e) {
            throw new StoreException("write failed: " + e.getMessage(), e);
        } finally {
            if (writeLock != null) {
                writeLock.unlock();
            }
        }

        log.debug("Stored artwork of provider track {} for {} ({} bytes)", best.providerTrackId(), id, artwork.length);
        return new FoundArtwork(id, best.providerTrackId(), artworkUrl, artwork.length, best.similarityScore());
    }

    /**
     * Interleaves skipped unselected entries with the dispatched outcomes, keeping input order.
     */
    private static List<Outcome<AppliedTags>> mergeOutcomes(List<TrackSelection> selections,
                                                           BatchReport<AppliedTags> dispatched) {
        List<Outcome<AppliedTags>> merged = new ArrayList<>(selections.size());
        Iterator<Outcome<AppliedTags>> it = dispatched.outcomes().iterator();
        for (TrackSelection selection : selections) {
            if (isDispatchable(selection)) {
                merged.add(it.next());
            } else {
                String id = selection == null ? null : selection.localTrackId();
                merged.add(Outcome.skipped(id, REASON_NO_SELECTION));
            }
        }
        return merged;
    }

    private static boolean isDispatchable(TrackSelection selection) {
        return selection != null && selection.localTrackId() != null && selection.hasSelection();
    }

    private RateLimitMonitor monitorForBatch() {
        return sharedRateLimit ? sharedMonitor : new RateLimitMonitor(clock);
    }

    private static ProgressEmitter emitterOrNone(ProgressEmitter emitter) {
        return emitter != null ? emitter : ProgressEmitter.NONE;
    }

    void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    void setSerializeWrites(boolean serializeWrites) {
        this.serializeWrites = serializeWrites;
    }

    void setSharedRateLimit(boolean sharedRateLimit) {
        this.sharedRateLimit = sharedRateLimit;
    }

    /**
     * Apply work item: the local track and the provider track chosen for it.
     */
    record ApplyTarget(LocalTrack track, long providerTrackId) {}
}
