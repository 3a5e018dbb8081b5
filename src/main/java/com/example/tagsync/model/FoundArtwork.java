package com.example.tagsync.model;

/**
 * Result payload of an artwork-only lookup for one track.
 *
 * @param matchScore similarity of the provider match the artwork was taken from
 */
public record FoundArtwork(
    String localTrackId,
    long providerTrackId,
    String artworkUrl,
    int sizeBytes,
    double matchScore
) {}
