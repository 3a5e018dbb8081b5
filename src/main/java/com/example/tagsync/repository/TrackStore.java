package com.example.tagsync.repository;

import com.example.tagsync.model.LocalTrack;
import com.example.tagsync.model.TrackTags;

import java.util.Collection;
import java.util.Map;

/**
 * Local library persistence used by the sync pipelines.
 * Implementations signal failures with Spring's {@code DataAccessException} hierarchy.
 */
public interface TrackStore {

    /**
     * Loads all requested tracks with one query. Unknown ids are simply absent from the result.
     */
    Map<String, LocalTrack> loadBatch(Collection<String> trackIds);

    /**
     * Writes the non-null tag values and, when given, the artwork, all or nothing. Repeating
     * the same call leaves the same state.
     */
    void persist(String trackId, TrackTags tags, byte[] artwork);

    /**
     * Stores (or replaces) only the artwork of a track; its tags stay as they are.
     */
    void persistArtwork(String trackId, byte[] artwork, String sourceUrl);
}
