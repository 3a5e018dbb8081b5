package com.example.tagsync.service.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Running batches by id, so that they can be cancelled from another thread.
 */
@Component
@Slf4j
public class BatchRegistry {

    private final ConcurrentMap<String, BatchCancellation> running = new ConcurrentHashMap<>();

    public BatchCancellation register(String batchId) {
        BatchCancellation cancellation = new BatchCancellation(batchId);
        BatchCancellation existing = running.putIfAbsent(batchId, cancellation);
        if (existing != null) {
            throw new IllegalStateException("Batch already running: " + batchId);
        }
        return cancellation;
    }

    public boolean cancel(String batchId) {
        BatchCancellation cancellation = running.get(batchId);
        if (cancellation == null) {
            return false;
        }
        if (cancellation.cancel()) {
            log.info("Cancellation requested for batch {}", batchId);
        }
        return true;
    }

    public void unregister(String batchId) {
        running.remove(batchId);
    }

    public List<String> running() {
        return List.copyOf(running.keySet());
    }

    public boolean isRunning(String batchId) {
        return running.containsKey(batchId);
    }
}
