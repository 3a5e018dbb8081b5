package com.example.tagsync.controller;

import com.example.tagsync.exception.StoreException;
import com.example.tagsync.model.ApplyReport;
import com.example.tagsync.model.ArtworkReport;
import com.example.tagsync.model.ProgressEvent;
import com.example.tagsync.model.SearchReport;
import com.example.tagsync.service.MetadataSyncService;
import com.example.tagsync.service.orchestration.BatchRegistry;
import com.example.tagsync.service.progress.LoggingProgressEmitter;
import com.example.tagsync.service.progress.ProgressBroadcaster;
import com.example.tagsync.service.progress.ProgressEmitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST API for the sync pipelines.
 *
 * POST /api/sync/search                     - candidate search for local tracks
 * POST /api/sync/apply                      - apply selected candidates
 * POST /api/sync/artwork                    - store cover art of the best match only
 * POST /api/sync/batches/{batchId}/cancel   - cancel a running batch
 * GET  /api/sync/batches                    - running batch ids
 * GET  /api/sync/progress                   - progress events (server-sent events)
 */
@RestController
@RequestMapping("/api/sync")
@Slf4j
public class SyncController {

    private final MetadataSyncService syncService;
    private final BatchRegistry batchRegistry;
    private final ProgressBroadcaster broadcaster;
    private final ProgressEmitter logEmitter = new LoggingProgressEmitter();
    private final long progressTimeoutMs;

    public SyncController(
            MetadataSyncService syncService,
            BatchRegistry batchRegistry,
            ProgressBroadcaster broadcaster,
            @Value("${app.sync.progress.timeout-ms:1800000}") long progressTimeoutMs) {
        this.syncService = syncService;
        this.batchRegistry = batchRegistry;
        this.broadcaster = broadcaster;
        this.progressTimeoutMs = progressTimeoutMs;
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(@RequestBody(required = false) SearchRequest request,
                                    @RequestParam(required = false) String batchId) {
        if (request == null || request.trackIds() == null || request.trackIds().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "trackIds must not be empty"));
        }
        try {
            SearchReport report = batchId == null || batchId.isBlank()
                    ? syncService.searchCandidates(request.trackIds(), this::emit)
                    : syncService.searchCandidates(batchId, request.trackIds(), this::emit);
            return ResponseEntity.ok(report);
        } catch (StoreException e) {
            log.error("Search aborted: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/apply")
    public ResponseEntity<?> apply(@RequestBody(required = false) ApplyRequest request,
                                   @RequestParam(required = false) String batchId) {
        if (request == null || request.selections() == null || request.selections().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "selections must not be empty"));
        }
        try {
            ApplyReport report = batchId == null || batchId.isBlank()
                    ? syncService.applySelections(request.selections(), this::emit)
                    : syncService.applySelections(batchId, request.selections(), this::emit);
            return ResponseEntity.ok(report);
        } catch (StoreException e) {
            log.error("Apply aborted: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/artwork")
    public ResponseEntity<?> artwork(@RequestBody(required = false) ArtworkRequest request,
                                     @RequestParam(required = false) String batchId) {
        if (request == null || request.trackIds() == null || request.trackIds().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "trackIds must not be empty"));
        }
        try {
            ArtworkReport report = batchId == null || batchId.isBlank()
                    ? syncService.findArtwork(request.trackIds(), this::emit)
                    : syncService.findArtwork(batchId, request.trackIds(), this::emit);
            return ResponseEntity.ok(report);
        } catch (StoreException e) {
            log.error("Artwork batch aborted: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/batches/{batchId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String batchId) {
        if (batchRegistry.cancel(batchId)) {
            return ResponseEntity.accepted().body(Map.of("batchId", batchId, "status", "CANCELLING"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "No running batch with id " + batchId));
    }

    @GetMapping("/batches")
    public List<String> running() {
        return batchRegistry.running();
    }

    @GetMapping(path = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter progress() {
        return broadcaster.subscribe(progressTimeoutMs);
    }

    private void emit(ProgressEvent event) {
        logEmitter.emit(event);
        broadcaster.emit(event);
    }
}
