package com.example.tagsync.model;

/**
 * Result payload of a successful apply for one track.
 */
public record AppliedTags(
    String localTrackId,
    long providerTrackId,
    TrackTags tags,
    boolean artworkEmbedded
) {}
