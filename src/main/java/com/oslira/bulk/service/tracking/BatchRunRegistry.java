package com.oslira.bulk.service.tracking;

import com.oslira.bulk.config.TraceContextManager;
import com.oslira.bulk.exception.BatchAlreadyFinishedException;
import com.oslira.bulk.exception.BatchNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of submitted runs by batch id.
 *
 * <p>Runs are kept while active and for a retention window after they finish, then
 * evicted on the next registration. Nothing survives a restart.
 */
@Component
@Slf4j
public class BatchRunRegistry {

    private final Map<String, BatchRun> runs = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public BatchRunRegistry(@Value("${app.bulk.progress-retention-minutes:60}") long retentionMinutes) {
        this(Duration.ofMinutes(retentionMinutes), Clock.systemUTC());
    }

    BatchRunRegistry(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    public BatchRun register(String accountId, String analysisType, int total) {
        evictExpired();
        BatchRun run = new BatchRun(TraceContextManager.newBatchId(), accountId, analysisType, total, clock);
        runs.put(run.getBatchId(), run);
        log.debug("Registered batch {} for account {} ({} items)", run.getBatchId(), accountId, total);
        return run;
    }

    /**
     * @throws BatchNotFoundException if no run is tracked under the id
     */
    public BatchRun require(String batchId) {
        BatchRun run = runs.get(batchId);
        if (run == null) {
            throw new BatchNotFoundException(batchId);
        }
        return run;
    }

    /**
     * Flag a run for cancellation. The group in flight finishes; later groups are skipped.
     *
     * @throws BatchNotFoundException        if no run is tracked under the id
     * @throws BatchAlreadyFinishedException if the run already reached a final status
     */
    public BatchRun cancel(String batchId) {
        BatchRun run = require(batchId);
        if (!run.requestCancel()) {
            throw new BatchAlreadyFinishedException(batchId, run.getStatus().code());
        }
        log.info("Cancel requested for batch {} ({})", batchId, run.getStatus().code());
        return run;
    }

    public int size() {
        return runs.size();
    }

    void evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        runs.values().removeIf(run -> {
            Instant finishedAt = run.getFinishedAt();
            return finishedAt != null && finishedAt.isBefore(cutoff);
        });
    }
}
