package com.example.tagsync.model;

import java.util.List;

/**
 * Outcomes of a batch, aligned with the input order, plus summary counts.
 */
public record BatchReport<T>(
    String batchId,
    List<Outcome<T>> outcomes,
    int total,
    int successCount,
    int failureCount,
    int skippedCount,
    long elapsedMs
) {

    public static <T> BatchReport<T> of(String batchId, List<Outcome<T>> outcomes, long elapsedMs) {
        int success = 0;
        int failure = 0;
        int skipped = 0;
        for (Outcome<T> outcome : outcomes) {
            switch (outcome.kind()) {
                case SUCCESS -> success++;
                case FAILURE -> failure++;
                case SKIPPED -> skipped++;
            }
        }
        return new BatchReport<>(batchId, List.copyOf(outcomes), outcomes.size(), success, failure, skipped, elapsedMs);
    }

    public static <T> BatchReport<T> empty(String batchId) {
        return new BatchReport<>(batchId, List.of(), 0, 0, 0, 0, 0);
    }

    public Outcome<T> outcomeAt(int index) {
        return outcomes.get(index);
    }
}
