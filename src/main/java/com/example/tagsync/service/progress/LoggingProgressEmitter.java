package com.example.tagsync.service.progress;

import com.example.tagsync.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes progress events to the log at DEBUG, and the final event at INFO.
 */
@Slf4j
public class LoggingProgressEmitter implements ProgressEmitter {

    @Override
    public void emit(ProgressEvent event) {
        if (event.isLast()) {
            log.info("[{}] {} finished {}/{}", event.batchId(), event.phase().tag(),
                    event.completedCount(), event.totalCount());
        } else {
            log.debug("[{}] {} {}/{} - {} {}", event.batchId(), event.phase().tag(),
                    event.completedCount(), event.totalCount(), event.currentId(), event.outcomeKind());
        }
    }
}
