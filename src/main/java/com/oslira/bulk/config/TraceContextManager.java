package com.oslira.bulk.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Trace and batch identifiers kept in the SLF4J MDC so every log line of a request,
 * including lines written on batch worker threads, can be correlated.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String BATCH_ID = "batchId";
    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String BATCH_ID_PREFIX = "batch_";

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = firstNonEmpty(request.getHeader(TRACE_HEADER), MDC.get(TRACE_ID));
        if (traceId == null) {
            traceId = generateTraceId();
        }
        String spanId = MDC.get(SPAN_ID);
        if (spanId == null || spanId.isEmpty()) {
            spanId = generateSpanId();
        }

        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, spanId);

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }
        return traceId;
    }

    /**
     * Start a batch run: generate its id and bind it to the MDC of the calling thread.
     */
    public static String bindNewBatch() {
        String batchId = newBatchId();
        bindBatch(batchId);
        return batchId;
    }

    public static String newBatchId() {
        return BATCH_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static void bindBatch(String batchId) {
        MDC.put(BATCH_ID, batchId);
    }

    public static void clearBatch() {
        MDC.remove(BATCH_ID);
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
        MDC.remove(BATCH_ID);
    }

    private static String firstNonEmpty(String first, String second) {
        if (first != null && !first.isEmpty()) {
            return first;
        }
        return second != null && !second.isEmpty() ? second : null;
    }
}
