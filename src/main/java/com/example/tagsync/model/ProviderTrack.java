package com.example.tagsync.model;

import java.util.List;

/**
 * Full track data fetched from the metadata provider.
 */
public record ProviderTrack(
    long id,
    String name,
    String mixName,
    List<String> artists,
    Double bpm,
    String key,
    String genre,
    String label,
    String album,
    String publishDate,
    String isrc,
    String catalogNumber,
    String artworkUrl
) {}
