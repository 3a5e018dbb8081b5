package com.example.tagsync.config;

import org.slf4j.MDC;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * MDC helper for request trace ids and sync batch ids.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String BATCH_ID = "batchId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isEmpty()) {
            traceId = MDC.get(TRACE_ID);
        }
        if (traceId == null || traceId.isEmpty()) {
            traceId = generateTraceId();
        }
        MDC.put(TRACE_ID, traceId);

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }
        return traceId;
    }

    /**
     * Puts the batch id into the MDC; returns the previous value so callers can restore it.
     */
    public static String enterBatch(String batchId) {
        String previous = MDC.get(BATCH_ID);
        MDC.put(BATCH_ID, batchId);
        return previous;
    }

    public static void exitBatch(String previous) {
        if (previous == null) {
            MDC.remove(BATCH_ID);
        } else {
            MDC.put(BATCH_ID, previous);
        }
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(BATCH_ID);
    }
}
