package com.example.tagsync.model;

/**
 * Result of a candidate search batch.
 *
 * @param withCandidates    tracks with at least one candidate
 * @param withoutCandidates tracks with no candidate, including failed and skipped ones
 */
public record SearchReport(
    BatchReport<TrackCandidates> report,
    int withCandidates,
    int withoutCandidates
) {

    public static SearchReport of(BatchReport<TrackCandidates> report) {
        int with = (int) report.outcomes().stream()
                .filter(o -> o.isSuccess() && o.payload().hasCandidates())
                .count();
        return new SearchReport(report, with, report.total() - with);
    }
}
