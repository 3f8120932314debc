package com.oslira.bulk.service.batch;

import com.oslira.bulk.model.AttemptRecord;
import com.oslira.bulk.model.BatchOutcome;
import com.oslira.bulk.model.ErrorKind;
import com.oslira.bulk.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one work item with bounded retries and exponential backoff.
 *
 * <p>Terminal failures stop after the attempt that raised them. Retryable failures
 * wait {@code baseDelay * 2^(attempt-1)} and try again until {@code maxAttempts}
 * is reached, then report the last error seen.
 */
@Component
@Slf4j
public class RetryController {

    private final BatchSettings settings;
    private final ErrorClassifier errorClassifier;
    private final Sleeper sleeper;

    @Autowired
    public RetryController(BatchSettings settings, ErrorClassifier errorClassifier) {
        this(settings, errorClassifier, Sleeper.THREAD_SLEEP);
    }

    RetryController(BatchSettings settings, ErrorClassifier errorClassifier, Sleeper sleeper) {
        this.settings = settings;
        this.errorClassifier = errorClassifier;
        this.sleeper = sleeper;
    }

    public <T> BatchOutcome<T> execute(WorkItem item, ItemProcessor<T> processor) {
        long startTime = System.currentTimeMillis();
        int maxAttempts = settings.maxAttempts();
        List<AttemptRecord> attemptLog = new ArrayList<>(maxAttempts);
        String lastError = null;
        ErrorKind lastKind = ErrorKind.UNKNOWN;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Instant attemptStart = Instant.now();
            try {
                T result = processor.process(item);
                attemptLog.add(AttemptRecord.success(attempt, attemptStart, Instant.now()));
                if (attempt > 1) {
                    log.info("Item {} succeeded on attempt {}/{}", item.id(), attempt, maxAttempts);
                }
                return BatchOutcome.succeeded(result, attempt, elapsedSince(startTime), attemptLog);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                attemptLog.add(AttemptRecord.failure(attempt, attemptStart, Instant.now(),
                        ErrorKind.UNKNOWN, "Processing interrupted"));
                log.warn("Item {} interrupted on attempt {}/{}", item.id(), attempt, maxAttempts);
                return BatchOutcome.failed("Processing interrupted", ErrorKind.UNKNOWN, attempt,
                        elapsedSince(startTime), attemptLog);
            } catch (Exception e) {
                lastKind = errorClassifier.classify(e);
                lastError = errorClassifier.describe(e);
                attemptLog.add(AttemptRecord.failure(attempt, attemptStart, Instant.now(), lastKind, lastError));

                log.warn("Item {} attempt {}/{} failed after {}ms [{}]: {}",
                        item.id(), attempt, maxAttempts, elapsedSince(startTime), lastKind, lastError);

                if (lastKind.isTerminal()) {
                    return BatchOutcome.failed(lastError, lastKind, attempt, elapsedSince(startTime), attemptLog);
                }

                if (attempt < maxAttempts) {
                    long delay = settings.backoffDelayMs(attempt);
                    log.debug("Retrying item {} in {}ms", item.id(), delay);
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        log.warn("Backoff interrupted for item {}, giving up after {} attempts", item.id(), attempt);
                        return BatchOutcome.failed(lastError, lastKind, attempt, elapsedSince(startTime), attemptLog);
                    }
                }
            }
        }

        log.error("Item {} failed after {} attempts: {}", item.id(), maxAttempts, lastError);
        return BatchOutcome.failed(lastError, lastKind, maxAttempts, elapsedSince(startTime), attemptLog);
    }

    private static long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
