package com.example.tagsync.service.orchestration;

import com.example.tagsync.config.SyncMetrics;
import com.example.tagsync.exception.ProviderException;
import com.example.tagsync.model.BatchReport;
import com.example.tagsync.model.Outcome;
import com.example.tagsync.model.ProgressEvent;
import com.example.tagsync.service.concurrency.ConcurrencyController;
import com.example.tagsync.service.concurrency.RateLimitMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs one batch of work items concurrently under a slot limit and adaptive pacing.
 *
 * <p>The calling thread dispatches: for each input position it takes a slot from the batch's
 * {@link ConcurrencyController} and only then hands the item to the shared sync executor, so a
 * batch never holds more pool threads than it has slots. A dispatched task:
 * <ol>
 *   <li>resolves its entity from the shared snapshot (unknown ids are skipped)</li>
 *   <li>waits the delay the {@link RateLimitMonitor} currently prescribes</li>
 *   <li>runs the {@link WorkOperation} and classifies the result</li>
 *   <li>releases its slot and emits a progress event</li>
 * </ol>
 * Failures stay inside their item; the report always has one outcome per input position,
 * in input order.
 */
@Service
@Slf4j
public class TaskOrchestrator {

    static final String REASON_CANCELLED = "cancelled";
    static final String REASON_NOT_FOUND = "not found locally";
    static final String REASON_DUPLICATE = "duplicate id";
    static final String REASON_RATE_LIMITED = "rate limited";
    static final String REASON_INTERRUPTED = "interrupted";
    static final String REASON_REJECTED = "executor unavailable";

    private final ExecutorService executor;
    private final SyncMetrics metrics;

    public TaskOrchestrator(@Qualifier("syncTaskExecutor") ExecutorService executor, SyncMetrics metrics) {
        this.executor = executor;
        this.metrics = metrics;
    }

    public <E, R> BatchReport<R> execute(BatchRequest<E, R> request) {
        List<String> ids = request.getIds();
        String batchId = request.getBatchId();
        if (ids.isEmpty()) {
            return BatchReport.empty(batchId);
        }

        long start = System.currentTimeMillis();
        int total = ids.size();
        ConcurrencyController controller = new ConcurrencyController(request.getConfig().maxConcurrent());
        BatchCancellation cancellation = request.cancellationOrNone();
        AtomicReferenceArray<Outcome<R>> outcomes = new AtomicReferenceArray<>(total);
        AtomicInteger completed = new AtomicInteger();

        log.info("Batch {} [{}] dispatching {} items (max {} concurrent, delay {}ms/{}ms)",
                batchId, request.getPhase().tag(), total, controller.maxConcurrent(),
                request.getConfig().minDelay().toMillis(), request.getConfig().throttledDelay().toMillis());

        Set<String> seen = new HashSet<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int index = i;
            String id = ids.get(i);
            if (!seen.add(id)) {
                complete(request, outcomes, completed, index, Outcome.skipped(id, REASON_DUPLICATE));
                continue;
            }
            if (cancellation.isCancelled()) {
                complete(request, outcomes, completed, index, Outcome.skipped(id, REASON_CANCELLED));
                continue;
            }

            ConcurrencyController.Slot slot;
            try {
                slot = controller.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch {} interrupted while dispatching, {} items not started", batchId, total - index);
                for (int j = index; j < total; j++) {
                    complete(request, outcomes, completed, j, Outcome.failure(ids.get(j), REASON_INTERRUPTED));
                }
                break;
            }

            try {
                futures.add(CompletableFuture.runAsync(() -> {
                    Outcome<R> outcome;
                    try (slot) {
                        outcome = runItem(request, cancellation, id);
                    }
                    complete(request, outcomes, completed, index, outcome);
                }, executor));
            } catch (RejectedExecutionException e) {
                slot.close();
                log.error("Sync executor rejected item {} of batch {}", id, batchId);
                complete(request, outcomes, completed, index, Outcome.failure(id, REASON_REJECTED));
            }
        }

        // Wait for all to complete
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Outcome<R>> ordered = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            ordered.add(outcomes.get(i));
        }
        BatchReport<R> report = BatchReport.of(batchId, ordered, System.currentTimeMillis() - start);

        log.info("Batch {} [{}] complete in {}ms: {} succeeded, {} failed, {} skipped",
                batchId, request.getPhase().tag(), report.elapsedMs(),
                report.successCount(), report.failureCount(), report.skippedCount());
        return report;
    }

    private <E, R> Outcome<R> runItem(BatchRequest<E, R> request, BatchCancellation cancellation, String id) {
        // the batch may have been cancelled while this item waited for its slot
        if (cancellation.isCancelled()) {
            return Outcome.skipped(id, REASON_CANCELLED);
        }

        try {
            E entity = request.getSnapshot().get(id);
            if (entity == null) {
                log.debug("Track {} not in snapshot, skipping", id);
                return Outcome.skipped(id, REASON_NOT_FOUND);
            }

            RateLimitMonitor monitor = request.getMonitor();
            Duration delay = monitor.effectiveDelay(request.getConfig());
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }

            if (cancellation.isCancelled()) {
                return Outcome.skipped(id, REASON_CANCELLED);
            }

            R payload = request.getOperation().execute(id, entity);
            return Outcome.success(id, payload);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Item {} interrupted", id);
            return Outcome.failure(id, REASON_INTERRUPTED);
        } catch (ProviderException e) {
            if (e.isRateLimited()) {
                request.getMonitor().recordSignal();
                metrics.incrementRateLimitSignals();
                log.warn("Item {} rate limited by provider, slowing down batch {}", id, request.getBatchId());
                return Outcome.failure(id, REASON_RATE_LIMITED);
            }
            log.warn("Item {} failed ({}): {}", id, e.getKind(), e.getMessage());
            return Outcome.failure(id, reasonOf(e));
        } catch (Exception e) {
            log.warn("Item {} failed: {}", id, e.getMessage());
            return Outcome.failure(id, reasonOf(e));
        }
    }

    private <E, R> void complete(BatchRequest<E, R> request, AtomicReferenceArray<Outcome<R>> outcomes,
                                 AtomicInteger completed, int index, Outcome<R> outcome) {
        outcomes.set(index, outcome);
        metrics.incrementOutcome(request.getPhase(), outcome.kind());
        int done = completed.incrementAndGet();
        emitSafely(request, new ProgressEvent(request.getBatchId(), request.getPhase(), done,
                request.getIds().size(), outcome.id(), outcome.kind()));
    }

    private static void emitSafely(BatchRequest<?, ?> request, ProgressEvent event) {
        try {
            request.getEmitter().emit(event);
        } catch (RuntimeException e) {
            log.warn("Progress emitter failed for {} in batch {}: {}",
                    event.currentId(), event.batchId(), e.getMessage());
        }
    }

    private static String reasonOf(Exception e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
