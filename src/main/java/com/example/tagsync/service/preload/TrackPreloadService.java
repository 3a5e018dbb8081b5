package com.example.tagsync.service.preload;

import com.example.tagsync.config.SyncMetrics;
import com.example.tagsync.exception.StoreException;
import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.repository.TrackStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Loads every local track a batch needs with one store query, before any work is dispatched.
 *
 * This is the key optimization: one round trip per batch instead of one per track. The
 * resulting snapshot is read-only and shared by all tasks of the batch.
 */
@Service
@Slf4j
public class TrackPreloadService {

    private final TrackStore trackStore;
    private final SyncMetrics metrics;

    public TrackPreloadService(TrackStore trackStore, SyncMetrics metrics) {
        this.trackStore = trackStore;
        this.metrics = metrics;
    }

    /**
     * @param trackIds ids to load; duplicates are queried once
     * @return unmodifiable id to track map; unknown ids are absent
     * @throws StoreException if the store query fails
     */
    public Map<String, LocalTrack> load(Collection<String> trackIds) {
        if (trackIds == null || trackIds.isEmpty()) {
            return Map.of();
        }

        Set<String> unique = new LinkedHashSet<>(trackIds);
        log.info("Preloading {} local tracks in a single batch query ({} requested)...",
                unique.size(), trackIds.size());
        long startTime = System.currentTimeMillis();

        Map<String, LocalTrack> loaded;
        try {
            loaded = trackStore.loadBatch(unique);
        } catch (RuntimeException e) {
            log.error("Batch load of {} tracks failed: {}", unique.size(), e.getMessage());
            throw new StoreException("Failed to load " + unique.size() + " tracks from the library", e);
        }

        long elapsedTime = System.currentTimeMillis() - startTime;
        metrics.recordPreloadTime(elapsedTime);
        log.info("Track preload completed in {}ms: {} of {} found", elapsedTime, loaded.size(), unique.size());

        return Collections.unmodifiableMap(loaded);
    }
}
