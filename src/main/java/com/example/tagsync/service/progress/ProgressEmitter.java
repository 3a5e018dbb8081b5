package com.example.tagsync.service.progress;

import com.example.tagsync.model.ProgressEvent;

/**
 * Receives one event per completed work item. Called from worker threads, so implementations
 * must be thread-safe and must not block for long.
 */
@FunctionalInterface
public interface ProgressEmitter {

    ProgressEmitter NONE = event -> { };

    void emit(ProgressEvent event);
}
