package com.example.tagsync.service.orchestration;

/**
 * The per-item unit of work run by {@link TaskOrchestrator}.
 *
 * @param <E> entity resolved from the batch snapshot
 * @param <R> payload produced on success
 */
@FunctionalInterface
public interface WorkOperation<E, R> {

    R execute(String id, E entity) throws Exception;
}
