package com.example.tagsync.model;

/**
 * Result of applying selected candidates to local tracks.
 */
public record ApplyReport(
    BatchReport<AppliedTags> report
) {

    public int successCount() {
        return report.successCount();
    }

    public int failureCount() {
        return report.failureCount();
    }
}
