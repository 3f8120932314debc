package com.oslira.bulk.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorConfigTest {

    private static final String TRACE_ID = "traceId";
    private static final String BATCH_ID = "batchId";

    private ExecutorService batchWorkerExecutor;

    @BeforeEach
    void setUp() {
        MDC.clear();
        batchWorkerExecutor = new ExecutorConfig().batchWorkerExecutor(4);
    }

    @AfterEach
    void tearDown() {
        batchWorkerExecutor.shutdownNow();
        MDC.clear();
    }

    @Test
    void shouldPropagateMdcWithExecute() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        final CountDownLatch latch = new CountDownLatch(1);
        final CompletableFuture<String> mdcValueFuture = new CompletableFuture<>();

        MDC.put(TRACE_ID, traceIdValue);

        batchWorkerExecutor.execute(() -> {
            try {
                mdcValueFuture.complete(MDC.get(TRACE_ID));
            } finally {
                latch.countDown();
            }
        });

        latch.await(5, TimeUnit.SECONDS);
        MDC.remove(TRACE_ID);

        assertThat(mdcValueFuture).isCompletedWithValue(traceIdValue);
        assertThat(MDC.get(TRACE_ID)).isNull();
    }

    @Test
    void shouldPropagateBatchIdWithSubmit() throws Exception {
        String batchId = TraceContextManager.bindNewBatch();

        Future<String> future = batchWorkerExecutor.submit(() -> MDC.get(BATCH_ID));

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(batchId);
    }

    @Test
    void shouldPropagateMdcWithSupplyAsync() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, traceIdValue);

        String seen = CompletableFuture.supplyAsync(() -> MDC.get(TRACE_ID), batchWorkerExecutor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo(traceIdValue);
    }

    @Test
    void shouldPropagateMdcWithInvokeAll() throws Exception {
        final String traceIdValue = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, traceIdValue);

        List<Callable<String>> tasks = IntStream.range(0, 5)
                .mapToObj(i -> (Callable<String>) () -> MDC.get(TRACE_ID))
                .collect(Collectors.toList());

        List<Future<String>> futures = batchWorkerExecutor.invokeAll(tasks, 5, TimeUnit.SECONDS);

        MDC.remove(TRACE_ID);

        for (Future<String> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(traceIdValue);
        }
    }

    @Test
    void workerThreadsDoNotKeepMdcBetweenTasks() throws Exception {
        ExecutorService single = new ExecutorConfig().batchWorkerExecutor(1);
        try {
            MDC.put(TRACE_ID, "first");
            single.submit(() -> MDC.get(TRACE_ID)).get(5, TimeUnit.SECONDS);
            MDC.clear();

            String leaked = single.submit(() -> MDC.get(TRACE_ID)).get(5, TimeUnit.SECONDS);

            assertThat(leaked).isNull();
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void workerThreadsAreNamedDaemons() throws Exception {
        Thread worker = batchWorkerExecutor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("batch-worker-");
        assertThat(worker.isDaemon()).isTrue();
    }

    @Test
    void runThreadsAreNamedAndCarryMdc() throws Exception {
        ExecutorService runs = new ExecutorConfig().batchRunExecutor(2);
        try {
            String batchId = TraceContextManager.bindNewBatch();

            Thread runner = runs.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
            String seen = runs.submit(() -> MDC.get(BATCH_ID)).get(5, TimeUnit.SECONDS);

            assertThat(runner.getName()).startsWith("batch-run-");
            assertThat(runner.isDaemon()).isTrue();
            assertThat(seen).isEqualTo(batchId);
        } finally {
            runs.shutdownNow();
        }
    }
}
