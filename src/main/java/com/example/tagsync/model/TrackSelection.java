package com.example.tagsync.model;

/**
 * The user's choice for one local track.
 *
 * @param providerTrackId chosen provider track, or null for "not available on the provider"
 */
public record TrackSelection(
    String localTrackId,
    Long providerTrackId
) {

    public boolean hasSelection() {
        return providerTrackId != null;
    }
}
