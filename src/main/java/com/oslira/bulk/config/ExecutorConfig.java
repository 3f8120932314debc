package com.oslira.bulk.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker threads for batch item processing.
 *
 * <p>The pool never limits concurrency itself: a run dispatches at most one group at a
 * time, so in-flight calls are capped by the group size. The pool size only bounds how
 * many runs can overlap across concurrent requests.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean(name = "batchWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService batchWorkerExecutor(
            @Value("${app.executor.worker-threads:32}") int workerThreads) {
        log.info("Creating batch worker executor with {} threads and MDC propagation", workerThreads);
        return new MdcPropagatingExecutorService(
                Executors.newFixedThreadPool(workerThreads, namedDaemonThreads("batch-worker-")));
    }

    /**
     * Threads that drive submitted runs in the background, one run per thread.
     * Submissions beyond the pool size queue until a run finishes.
     */
    @Bean(name = "batchRunExecutor", destroyMethod = "shutdown")
    public ExecutorService batchRunExecutor(
            @Value("${app.executor.run-threads:4}") int runThreads) {
        log.info("Creating batch run executor with {} threads and MDC propagation", runThreads);
        return new MdcPropagatingExecutorService(
                Executors.newFixedThreadPool(runThreads, namedDaemonThreads("batch-run-")));
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
