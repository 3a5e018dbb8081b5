package com.example.tagsync.model;

/**
 * Result of an artwork-only batch.
 */
public record ArtworkReport(
    BatchReport<FoundArtwork> report
) {

    public int successCount() {
        return report.successCount();
    }

    public int failureCount() {
        return report.failureCount();
    }
}
