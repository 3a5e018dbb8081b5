package com.example.tagsync.model;

/**
 * Emitted once per completed work item, in completion order.
 */
public record ProgressEvent(
    String batchId,
    SyncPhase phase,
    int completedCount,
    int totalCount,
    String currentId,
    OutcomeKind outcomeKind
) {

    public boolean isLast() {
        return completedCount == totalCount;
    }
}
