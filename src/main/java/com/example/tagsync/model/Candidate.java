package com.example.tagsync.model;

/**
 * Provider-side match proposed for a local track, shown to the user for selection.
 *
 * @param similarityScore match score between 0.0 and 1.0
 */
public record Candidate(
    long providerTrackId,
    String title,
    String mixName,
    String artists,
    Double bpm,
    String key,
    Double durationSecs,
    String artworkUrl,
    double similarityScore,
    String genre,
    String label,
    String releaseDate
) {}
