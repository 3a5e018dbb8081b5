package com.example.tagsync.service.orchestration;

import com.example.tagsync.model.SyncPhase;
import com.example.tagsync.service.concurrency.ConcurrencyConfig;
import com.example.tagsync.service.concurrency.RateLimitMonitor;
import com.example.tagsync.service.progress.ProgressEmitter;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.Map;

/**
 * Everything {@link TaskOrchestrator} needs to run one batch.
 */
@Getter
@Builder
public class BatchRequest<E, R> {

    @NonNull
    private final String batchId;

    @NonNull
    private final SyncPhase phase;

    /** Input order; may contain duplicates. */
    @NonNull
    private final List<String> ids;

    /** Read-only snapshot shared by every task. */
    @NonNull
    private final Map<String, E> snapshot;

    @NonNull
    private final ConcurrencyConfig config;

    @NonNull
    private final RateLimitMonitor monitor;

    @NonNull
    private final WorkOperation<E, R> operation;

    @Builder.Default
    private final ProgressEmitter emitter = ProgressEmitter.NONE;

    private final BatchCancellation cancellation;

    public BatchCancellation cancellationOrNone() {
        return cancellation != null ? cancellation : BatchCancellation.none(batchId);
    }
}
