package com.example.tagsync.service.orchestration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for one batch. Items that have not started their work yet are skipped once set.
 */
public class BatchCancellation {

    private final String batchId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchCancellation(String batchId) {
        this.batchId = batchId;
    }

    public static BatchCancellation none(String batchId) {
        return new BatchCancellation(batchId);
    }

    public String batchId() {
        return batchId;
    }

    /**
     * @return true if this call flipped the flag
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
