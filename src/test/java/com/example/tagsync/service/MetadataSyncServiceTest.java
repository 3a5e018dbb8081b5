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
import com.example.tagsync.model.Candidate;
import com.example.tagsync.model.FoundArtwork;
import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.model.OutcomeKind;
import com.example.tagsync.model.ProviderTrack;
import com.example.tagsync.model.SearchReport;
import com.example.tagsync.model.SyncPhase;
import com.example.tagsync.model.TrackSelection;
import com.example.tagsync.model.TrackTags;
import com.example.tagsync.repository.TrackStore;
import com.example.tagsync.service.concurrency.ConcurrencyConfig;
import com.example.tagsync.service.concurrency.RateLimitMonitor;
import com.example.tagsync.service.orchestration.BatchRegistry;
import com.example.tagsync.service.orchestration.TaskOrchestrator;
import com.example.tagsync.service.preload.TrackPreloadService;
import com.example.tagsync.service.progress.ProgressEmitter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MetadataSyncService.
 *
 * Tests verify:
 * - Search and apply pipelines end to end with mocked provider and store
 * - Load failures abort the batch before any provider call
 * - Unselected entries are skipped, artwork failures are tolerated
 * - Apply keeps a local BPM
 * - Artwork-only batches store cover art without touching tags
 * - Writes of one apply batch never overlap
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MetadataSyncServiceTest {

    private static final ConcurrencyConfig FAST = new ConcurrencyConfig(4, Duration.ZERO, Duration.ZERO);

    @Mock
    private TrackStore trackStore;

    @Mock
    private MetadataClient metadataClient;

    @Mock
    private ArtworkFetcher artworkFetcher;

    private ExecutorService executor;
    private BatchRegistry batchRegistry;
    private SyncMetrics metrics;
    private MetadataSyncService syncService;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        metrics = new SyncMetrics(new SimpleMeterRegistry());
        batchRegistry = new BatchRegistry();
        syncService = new MetadataSyncService(
                new TrackPreloadService(trackStore, metrics),
                new TaskOrchestrator(executor, metrics),
                metadataClient,
                artworkFetcher,
                trackStore,
                batchRegistry,
                metrics,
                FAST,
                new ConcurrencyConfig(3, Duration.ZERO, Duration.ZERO),
                new RateLimitMonitor(),
                Clock.systemUTC());
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    // ═══════════════════════════════════════════════════════════════
    // SEARCH
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Empty search returns an empty report without touching the store")
    void emptySearch() {
        SearchReport report = syncService.searchCandidates(List.of(), ProgressEmitter.NONE);

        assertThat(report.report().total()).isZero();
        verifyNoInteractions(trackStore, metadataClient);
    }

    @Test
    @DisplayName("Search reports tracks with and without candidates in input order")
    void searchCandidates() throws Exception {
        // Given
        givenTracks("a", "b");
        when(metadataClient.search(any(), anyInt(), anyDouble())).thenAnswer(inv -> {
            LocalTrack track = inv.getArgument(0);
            return track.id().equals("a") ? List.of(candidate(101L)) : List.of();
        });

        // When
        SearchReport report = syncService.searchCandidates(List.of("a", "b", "c"), ProgressEmitter.NONE);

        // Then
        assertThat(report.report().total()).isEqualTo(3);
        assertThat(report.withCandidates()).isEqualTo(1);
        assertThat(report.withoutCandidates()).isEqualTo(2);
        assertThat(report.report().outcomeAt(0).payload().candidates())
                .extracting(Candidate::providerTrackId).containsExactly(101L);
        assertThat(report.report().outcomeAt(1).kind()).isEqualTo(OutcomeKind.SUCCESS);
        assertThat(report.report().outcomeAt(2).kind()).isEqualTo(OutcomeKind.SKIPPED);
        assertThat(metrics.getBatchTimers().get(SyncPhase.SEARCHING).count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Search uses the configured result limit and minimum score")
    void searchUsesConfiguredLimits() throws Exception {
        givenTracks("a");
        when(metadataClient.search(any(), anyInt(), anyDouble())).thenReturn(List.of());

        syncService.searchCandidates(List.of("a"), ProgressEmitter.NONE);
        verify(metadataClient).search(any(LocalTrack.class), eq(4), eq(0.25));

        syncService.setMaxResults(2);
        syncService.setMinScore(0.5);
        syncService.searchCandidates(List.of("a"), ProgressEmitter.NONE);
        verify(metadataClient).search(any(LocalTrack.class), eq(2), eq(0.5));
    }

    @Test
    @DisplayName("Store failure aborts the search before any provider call")
    void searchStoreFailure() {
        // Given
        when(trackStore.loadBatch(anyCollection())).thenThrow(new DataAccessResourceFailureException("db down"));

        // When / Then
        assertThatThrownBy(() -> syncService.searchCandidates("batch-x", List.of("a"), ProgressEmitter.NONE))
                .isInstanceOf(StoreException.class);
        verifyNoInteractions(metadataClient);
        assertThat(batchRegistry.running()).isEmpty();
    }

    @Test
    @DisplayName("Batch is registered and in the MDC while it runs, and cleaned up afterwards")
    void batchRegisteredWhileRunning() throws Exception {
        // Given
        givenTracks("a");
        List<String> runningDuringCall = new CopyOnWriteArrayList<>();
        when(metadataClient.search(any(), anyInt(), anyDouble())).thenAnswer(inv -> {
            runningDuringCall.addAll(batchRegistry.running());
            return List.of();
        });
        MDC.put(TraceContextManager.BATCH_ID, "outer");

        // When
        SearchReport report = syncService.searchCandidates("batch-42", List.of("a"), ProgressEmitter.NONE);

        // Then
        assertThat(report.report().batchId()).isEqualTo("batch-42");
        assertThat(runningDuringCall).containsExactly("batch-42");
        assertThat(batchRegistry.running()).isEmpty();
        assertThat(MDC.get(TraceContextManager.BATCH_ID)).isEqualTo("outer");
    }

    @Test
    @DisplayName("Null track ids are rejected")
    void nullTrackIdRejected() {
        assertThatThrownBy(() -> syncService.searchCandidates(Arrays.asList("a", null), ProgressEmitter.NONE))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(trackStore);
    }

    // ═══════════════════════════════════════════════════════════════
    // APPLY
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Apply fetches, downloads artwork and persists each selected track")
    void applySelections() throws Exception {
        // Given
        givenTracks("a", "b");
        when(metadataClient.fetchTrack(anyLong())).thenAnswer(inv -> providerTrack(inv.<Long>getArgument(0), "http://img/1.jpg"));
        byte[] artwork = {1, 2, 3};
        when(artworkFetcher.download("http://img/1.jpg")).thenReturn(artwork);

        // When
        ApplyReport report = syncService.applySelections(List.of(
                new TrackSelection("a", 11L),
                new TrackSelection("b", 12L)), ProgressEmitter.NONE);

        // Then
        assertThat(report.successCount()).isEqualTo(2);
        AppliedTags applied = report.report().outcomeAt(0).payload();
        assertThat(applied.providerTrackId()).isEqualTo(11L);
        assertThat(applied.artworkEmbedded()).isTrue();
        assertThat(applied.tags().title()).isEqualTo("Track 11 (Extended Mix)");

        ArgumentCaptor<TrackTags> tags = ArgumentCaptor.forClass(TrackTags.class);
        verify(trackStore).persist(eq("a"), tags.capture(), eq(artwork));
        assertThat(tags.getValue().year()).isEqualTo(2021);
        assertThat(tags.getValue().providerTrackId()).isEqualTo(11L);
    }

    @Test
    @DisplayName("Selections without a provider track are skipped and not loaded")
    @SuppressWarnings("unchecked")
    void unselectedEntriesSkipped() throws Exception {
        // Given
        givenTracks("a", "b");
        when(metadataClient.fetchTrack(anyLong())).thenAnswer(inv -> providerTrack(inv.<Long>getArgument(0), null));
        List<TrackSelection> selections = new ArrayList<>();
        selections.add(new TrackSelection("a", null));
        selections.add(null);
        selections.add(new TrackSelection("b", 12L));

        // When
        ApplyReport report = syncService.applySelections(selections, ProgressEmitter.NONE);

        // Then
        assertThat(report.report().total()).isEqualTo(3);
        assertThat(report.report().outcomeAt(0).kind()).isEqualTo(OutcomeKind.SKIPPED);
        assertThat(report.report().outcomeAt(0).reason()).isEqualTo("no candidate selected");
        assertThat(report.report().outcomeAt(1).kind()).isEqualTo(OutcomeKind.SKIPPED);
        assertThat(report.report().outcomeAt(2).kind()).isEqualTo(OutcomeKind.SUCCESS);
        assertThat(report.report().outcomeAt(2).id()).isEqualTo("b");

        ArgumentCaptor<Collection<String>> loaded = ArgumentCaptor.forClass(Collection.class);
        verify(trackStore).loadBatch(loaded.capture());
        assertThat(loaded.getValue()).containsExactly("b");
    }

    @Test
    @DisplayName("Selections with nothing selected never touch the store")
    void allUnselected() {
        ApplyReport report = syncService.applySelections(List.of(new TrackSelection("a", null)), ProgressEmitter.NONE);

        assertThat(report.report().skippedCount()).isEqualTo(1);
        verifyNoInteractions(trackStore, metadataClient);
    }

    @Test
    @DisplayName("Artwork failure is tolerated, tags are still written")
    void artworkFailureTolerated() throws Exception {
        // Given
        givenTracks("a");
        when(metadataClient.fetchTrack(anyLong())).thenAnswer(inv -> providerTrack(inv.<Long>getArgument(0), "http://img/x.jpg"));
        when(artworkFetcher.download(anyString())).thenThrow(new IOException("HTTP 500"));

        // When
        ApplyReport report = syncService.applySelections(List.of(new TrackSelection("a", 11L)), ProgressEmitter.NONE);

        // Then
        assertThat(report.successCount()).isEqualTo(1);
        assertThat(report.report().outcomeAt(0).payload().artworkEmbedded()).isFalse();
        verify(trackStore).persist(eq("a"), any(TrackTags.class), isNull());
    }

    @Test
    @DisplayName("Persist failure fails only that item")
    void persistFailure() throws Exception {
        // Given
        givenTracks("a", "b");
        when(metadataClient.fetchTrack(anyLong())).thenAnswer(inv -> providerTrack(inv.<Long>getArgument(0), null));
        doThrow(new DataIntegrityViolationException("constraint"))
                .when(trackStore).persist(eq("a"), any(), any());

        // When
        ApplyReport report = syncService.applySelections(List.of(
                new TrackSelection("a", 11L),
                new TrackSelection("b", 12L)), ProgressEmitter.NONE);

        // Then
        assertThat(report.report().outcomeAt(0).kind()).isEqualTo(OutcomeKind.FAILURE);
        assertThat(report.report().outcomeAt(0).reason()).startsWith("write failed:");
        assertThat(report.report().outcomeAt(1).kind()).isEqualTo(OutcomeKind.SUCCESS);
    }

    @Test
    @DisplayName("Provider failures are reported per item")
    void providerFailure() throws Exception {
        givenTracks("a");
        when(metadataClient.fetchTrack(anyLong()))
                .thenThrow(new ProviderException(ProviderErrorKind.NOT_FOUND, "track restricted"));

        ApplyReport report = syncService.applySelections(List.of(new TrackSelection("a", 11L)), ProgressEmitter.NONE);

        assertThat(report.failureCount()).isEqualTo(1);
        assertThat(report.report().outcomeAt(0).reason()).isEqualTo("track restricted");
        verify(trackStore, never()).persist(anyString(), any(), any());
    }

    @Test
    @DisplayName("Writes of one apply batch are serialized")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void writesSerialized() throws Exception {
        // Given
        String[] ids = IntStream.range(0, 6).mapToObj(i -> "t" + i).toArray(String[]::new);
        givenTracks(ids);
        when(metadataClient.fetchTrack(anyLong())).thenAnswer(inv -> providerTrack(inv.<Long>getArgument(0), null));
        AtomicInteger writing = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        doAnswer(inv -> {
            peak.accumulateAndGet(writing.incrementAndGet(), Math::max);
            Thread.sleep(30);
            writing.decrementAndGet();
            return null;
        }).when(trackStore).persist(anyString(), any(), any());

        List<TrackSelection> selections = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            selections.add(new TrackSelection(ids[i], 100L + i));
        }

        // When
        ApplyReport report = syncService.applySelections(selections, ProgressEmitter.NONE);

        // Then
        assertThat(report.successCount()).isEqualTo(6);
        assertThat(peak.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Apply keeps a BPM the local track already has")
    void applyKeepsLocalBpm() throws Exception {
        // Given
        LocalTrack tagged = new LocalTrack("a", "/music/a.mp3", "Title a", "Artist", null, null, null, 360.0,
                124.0, null, null, null, null);
        when(trackStore.loadBatch(anyCollection())).thenReturn(Map.of("a", tagged));
        when(metadataClient.fetchTrack(anyLong())).thenAnswer(inv -> providerTrack(inv.<Long>getArgument(0), null));

        // When
        ApplyReport report = syncService.applySelections(List.of(new TrackSelection("a", 11L)), ProgressEmitter.NONE);

        // Then
        assertThat(report.successCount()).isEqualTo(1);
        ArgumentCaptor<TrackTags> tags = ArgumentCaptor.forClass(TrackTags.class);
        verify(trackStore).persist(eq("a"), tags.capture(), isNull());
        assertThat(tags.getValue().bpm()).isNull();
        assertThat(tags.getValue().key()).isEqualTo("F# min");
    }

    // ═══════════════════════════════════════════════════════════════
    // ARTWORK ONLY
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Artwork batch stores the best match's cover art and never writes tags")
    void findArtwork() throws Exception {
        // Given
        givenTracks("a", "b");
        when(metadataClient.search(any(), anyInt(), anyDouble()))
                .thenReturn(List.of(candidateWithArtwork(101L, "http://img/101.jpg")));
        byte[] artwork = {7, 7, 7, 7};
        when(artworkFetcher.download("http://img/101.jpg")).thenReturn(artwork);

        // When
        ArtworkReport report = syncService.findArtwork("batch-art", List.of("a", "b", "c"), ProgressEmitter.NONE);

        // Then
        assertThat(report.report().batchId()).isEqualTo("batch-art");
        assertThat(report.successCount()).isEqualTo(2);
        assertThat(report.report().outcomeAt(2).kind()).isEqualTo(OutcomeKind.SKIPPED);
        FoundArtwork found = report.report().outcomeAt(0).payload();
        assertThat(found.providerTrackId()).isEqualTo(101L);
        assertThat(found.sizeBytes()).isEqualTo(4);
        verify(metadataClient, times(2)).search(any(LocalTrack.class), eq(1), eq(0.25));
        verify(trackStore).persistArtwork("a", artwork, "http://img/101.jpg");
        verify(trackStore).persistArtwork("b", artwork, "http://img/101.jpg");
        verify(trackStore, never()).persist(anyString(), any(), any());
        verify(metadataClient, never()).fetchTrack(anyLong());
        assertThat(metrics.getBatchTimers().get(SyncPhase.ARTWORK).count()).isEqualTo(1);
        assertThat(batchRegistry.running()).isEmpty();
    }

    @Test
    @DisplayName("Artwork batch reports missing matches, missing artwork and failed downloads per item")
    void findArtworkFailures() throws Exception {
        // Given
        givenTracks("none", "bare", "broken");
        when(metadataClient.search(any(), anyInt(), anyDouble())).thenAnswer(inv -> {
            LocalTrack track = inv.getArgument(0);
            switch (track.id()) {
                case "none":
                    return List.of();
                case "bare":
                    return List.of(candidate(201L));
                default:
                    return List.of(candidateWithArtwork(202L, "http://img/202.jpg"));
            }
        });
        when(artworkFetcher.download(anyString())).thenThrow(new IOException("HTTP 500"));

        // When
        ArtworkReport report = syncService.findArtwork(List.of("none", "bare", "broken"), ProgressEmitter.NONE);

        // Then
        assertThat(report.failureCount()).isEqualTo(3);
        assertThat(report.report().outcomeAt(0).reason()).isEqualTo("no match found");
        assertThat(report.report().outcomeAt(1).reason()).isEqualTo("match has no artwork");
        assertThat(report.report().outcomeAt(2).reason()).isEqualTo("artwork download failed: HTTP 500");
        verify(trackStore, never()).persistArtwork(anyString(), any(), any());
    }

    @Test
    @DisplayName("Artwork write failure fails only that item")
    void findArtworkWriteFailure() throws Exception {
        // Given
        givenTracks("a", "b");
        when(metadataClient.search(any(), anyInt(), anyDouble()))
                .thenReturn(List.of(candidateWithArtwork(101L, "http://img/101.jpg")));
        when(artworkFetcher.download(anyString())).thenReturn(new byte[]{1});
        doThrow(new DataIntegrityViolationException("fk"))
                .when(trackStore).persistArtwork(eq("a"), any(), any());

        // When
        ArtworkReport report = syncService.findArtwork(List.of("a", "b"), ProgressEmitter.NONE);

        // Then
        assertThat(report.report().outcomeAt(0).kind()).isEqualTo(OutcomeKind.FAILURE);
        assertThat(report.report().outcomeAt(0).reason()).startsWith("write failed:");
        assertThat(report.report().outcomeAt(1).kind()).isEqualTo(OutcomeKind.SUCCESS);
    }

    @Test
    @DisplayName("Empty artwork batch touches nothing")
    void emptyArtworkBatch() {
        ArtworkReport report = syncService.findArtwork(List.of(), ProgressEmitter.NONE);

        assertThat(report.report().total()).isZero();
        verifyNoInteractions(trackStore, metadataClient, artworkFetcher);
    }

    private void givenTracks(String... ids) {
        Map<String, LocalTrack> tracks = new HashMap<>();
        for (String id : ids) {
            tracks.put(id, new LocalTrack(id, "/music/" + id + ".mp3", "Title " + id, "Artist",
                    null, null, null, 360.0, null, null, null, null, null));
        }
        when(trackStore.loadBatch(anyCollection())).thenAnswer(inv -> {
            Collection<String> requested = inv.getArgument(0);
            Map<String, LocalTrack> found = new HashMap<>();
            requested.forEach(id -> {
                if (tracks.containsKey(id)) {
                    found.put(id, tracks.get(id));
                }
            });
            return found;
        });
    }

    private static Candidate candidate(long providerId) {
        return new Candidate(providerId, "Title", null, "Artist", 128.0, "A min", 360.0,
                null, 0.9, "Techno", "Label", "2021-03-05");
    }

    private static Candidate candidateWithArtwork(long providerId, String artworkUrl) {
        return new Candidate(providerId, "Title", null, "Artist", 128.0, "A min", 360.0,
                artworkUrl, 0.9, "Techno", "Label", "2021-03-05");
    }

    private static ProviderTrack providerTrack(long id, String artworkUrl) {
        return new ProviderTrack(id, "Track " + id, "Extended Mix", List.of("Artist One", "Artist Two"),
                126.0, "F# min", "Techno", "Label", "Album", "2021-03-05", "ISRC" + id, "CAT" + id, artworkUrl);
    }
}
