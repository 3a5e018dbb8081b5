package com.example.tagsync.model;

/**
 * Track as stored in the local library.
 */
public record LocalTrack(
    String id,
    String path,
    String title,
    String artist,
    String album,
    String genre,
    Integer year,
    double duration,
    Double bpm,
    String key,
    String label,
    String isrc,
    Long providerTrackId
) {

    /**
     * File name component of the track path, or null when the path has none.
     */
    public String fileName() {
        if (path == null || path.isBlank()) {
            return null;
        }
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        String name = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        return name.isEmpty() ? null : name;
    }
}
