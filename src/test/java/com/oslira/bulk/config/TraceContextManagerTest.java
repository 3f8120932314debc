package com.oslira.bulk.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TraceContextManagerTest {

    @BeforeEach
    void before() {
        TraceContextManager.clear();
    }

    @AfterEach
    void after() {
        TraceContextManager.clear();
    }

    @Test
    void ensureForHttp_populatesMdcAndResponseHeader() {
        HttpServletRequest req = mock(HttpServletRequest.class);
        HttpServletResponse resp = mock(HttpServletResponse.class);

        when(req.getHeader(TraceContextManager.TRACE_HEADER)).thenReturn(null);

        String traceId = TraceContextManager.ensureForHttp(req, resp);

        assertNotNull(traceId);
        assertEquals(32, traceId.length());
        assertEquals(traceId, MDC.get(TraceContextManager.TRACE_ID));
        assertEquals(16, MDC.get(TraceContextManager.SPAN_ID).length());

        verify(resp).setHeader(TraceContextManager.TRACE_HEADER, traceId);
    }

    @Test
    void bindNewBatch_putsBatchIdInMdcUntilCleared() {
        String batchId = TraceContextManager.bindNewBatch();

        assertTrue(batchId.startsWith("batch_"));
        assertEquals(22, batchId.length());
        assertEquals(batchId, MDC.get(TraceContextManager.BATCH_ID));

        TraceContextManager.clearBatch();
        assertNull(MDC.get(TraceContextManager.BATCH_ID));
    }

    @Test
    void bindNewBatch_generatesDistinctIds() {
        assertNotEquals(TraceContextManager.bindNewBatch(), TraceContextManager.bindNewBatch());
    }

    @Test
    void newBatchId_doesNotTouchMdcUntilBound() {
        String batchId = TraceContextManager.newBatchId();

        assertTrue(batchId.startsWith(TraceContextManager.BATCH_ID_PREFIX));
        assertNull(MDC.get(TraceContextManager.BATCH_ID));

        TraceContextManager.bindBatch(batchId);
        assertEquals(batchId, MDC.get(TraceContextManager.BATCH_ID));
    }
}
