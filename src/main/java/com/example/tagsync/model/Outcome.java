package com.example.tagsync.model;

/**
 * Final classification of one work item in a batch.
 * A success carries a payload, failures and skips carry a reason.
 */
public record Outcome<T>(
    String id,
    OutcomeKind kind,
    T payload,
    String reason
) {

    public static <T> Outcome<T> success(String id, T payload) {
        return new Outcome<>(id, OutcomeKind.SUCCESS, payload, null);
    }

    public static <T> Outcome<T> failure(String id, String reason) {
        return new Outcome<>(id, OutcomeKind.FAILURE, null, reason);
    }

    public static <T> Outcome<T> skipped(String id, String reason) {
        return new Outcome<>(id, OutcomeKind.SKIPPED, null, reason);
    }

    public boolean isSuccess() {
        return kind == OutcomeKind.SUCCESS;
    }
}
