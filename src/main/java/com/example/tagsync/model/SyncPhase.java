package com.example.tagsync.model;

/**
 * Pipeline a batch belongs to; used in progress events, logs and metric tags.
 */
public enum SyncPhase {
    SEARCHING,
    APPLYING,
    /** Artwork-only batch: best match's cover art, tags untouched. */
    ARTWORK;

    public String tag() {
        return name().toLowerCase();
    }
}
