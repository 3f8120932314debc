package com.oslira.bulk.service.batch;

import com.oslira.bulk.exception.ItemProcessingException;
import com.oslira.bulk.model.AttemptOutcome;
import com.oslira.bulk.model.AttemptRecord;
import com.oslira.bulk.model.BatchOutcome;
import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.ErrorKind;
import com.oslira.bulk.model.WorkItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RetryController.
 *
 * Backoff sleeps go through a recording Sleeper so delays are asserted, not waited for.
 */
class RetryControllerTest {

    private static final WorkItem ITEM = new WorkItem("natgeo", ComplexityClass.DEEP);

    private List<Long> sleeps;
    private RetryController retryController;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        retryController = new RetryController(
                new BatchSettings(3, 5000, 1000), new ErrorClassifier(), sleeps::add);
    }

    @AfterEach
    void tearDown() {
        // clear a flag left by the interrupt tests
        Thread.interrupted();
    }

    @Test
    @DisplayName("Should succeed on the first attempt without sleeping")
    void shouldSucceedFirstTime() {
        // When
        BatchOutcome<String> outcome = retryController.execute(ITEM, item -> "scored " + item.id());

        // Then
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.payload()).isEqualTo("scored natgeo");
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.errorMessage()).isNull();
        assertThat(outcome.attemptLog()).extracting(AttemptRecord::outcome)
                .containsExactly(AttemptOutcome.SUCCESS);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Terminal failure should stop after exactly one attempt")
    void shouldNotRetryTerminalFailure() {
        AtomicInteger calls = new AtomicInteger();

        BatchOutcome<String> outcome = retryController.execute(ITEM, item -> {
            calls.incrementAndGet();
            throw ItemProcessingException.fromCode("INSUFFICIENT_CREDITS", "Balance is 0");
        });

        assertThat(calls.get()).isEqualTo(1);
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.INSUFFICIENT_RESOURCE);
        assertThat(outcome.errorMessage()).contains("INSUFFICIENT_CREDITS");
        assertThat(outcome.attemptLog()).extracting(AttemptRecord::outcome)
                .containsExactly(AttemptOutcome.TERMINAL_FAILURE);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Transient failures should exhaust attempts and report the last error")
    void shouldExhaustAttemptsAndReportLastError() {
        AtomicInteger calls = new AtomicInteger();

        BatchOutcome<String> outcome = retryController.execute(ITEM, item -> {
            int n = calls.incrementAndGet();
            throw new IllegalStateException("timeout #" + n);
        });

        assertThat(calls.get()).isEqualTo(3);
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.retries()).isEqualTo(2);
        assertThat(outcome.errorMessage()).isEqualTo("timeout #3");
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(outcome.attemptLog()).extracting(AttemptRecord::attemptNumber).containsExactly(1, 2, 3);
        assertThat(outcome.attemptLog()).extracting(AttemptRecord::outcome)
                .containsOnly(AttemptOutcome.RETRYABLE_FAILURE);
    }

    @Test
    @DisplayName("Backoff should wait base, then 2x base, and never after the last attempt")
    void shouldBackOffExponentially() {
        retryController.execute(ITEM, item -> {
            throw ItemProcessingException.transientFailure("SCRAPER_TIMEOUT", "slow", null);
        });

        assertThat(sleeps).containsExactly(5000L, 10000L);
    }

    @Test
    @DisplayName("Four attempts should wait 1x, 2x and 4x the base delay")
    void shouldDoubleDelayForEveryAttempt() {
        RetryController fourAttempts = new RetryController(
                new BatchSettings(4, 100, 0), new ErrorClassifier(), sleeps::add);

        fourAttempts.execute(ITEM, item -> {
            throw new IllegalStateException("flaky");
        });

        assertThat(sleeps).containsExactly(100L, 200L, 400L);
    }

    @Test
    @DisplayName("Should succeed on a later attempt after a transient failure")
    void shouldSucceedOnRetry() {
        AtomicInteger calls = new AtomicInteger();

        BatchOutcome<Integer> outcome = retryController.execute(ITEM, item -> {
            if (calls.incrementAndGet() < 2) {
                throw ItemProcessingException.transientFailure("SCRAPER_TIMEOUT", "slow", null);
            }
            return 87;
        });

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.payload()).isEqualTo(87);
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(outcome.attemptLog()).extracting(AttemptRecord::outcome)
                .containsExactly(AttemptOutcome.RETRYABLE_FAILURE, AttemptOutcome.SUCCESS);
        assertThat(sleeps).containsExactly(5000L);
    }

    @Test
    @DisplayName("Terminal failure after a transient one should stop retrying")
    void shouldStopWhenLaterAttemptIsTerminal() {
        AtomicInteger calls = new AtomicInteger();

        BatchOutcome<String> outcome = retryController.execute(ITEM, item -> {
            if (calls.incrementAndGet() == 1) {
                throw ItemProcessingException.transientFailure("SCRAPER_TIMEOUT", "slow", null);
            }
            throw ItemProcessingException.fromCode("NOT_FOUND", "Profile does not exist");
        });

        assertThat(calls.get()).isEqualTo(2);
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Single-attempt settings should never retry")
    void shouldNotRetryWithOneAttempt() {
        RetryController once = new RetryController(new BatchSettings(1, 100, 0), new ErrorClassifier(), sleeps::add);

        BatchOutcome<String> outcome = once.execute(ITEM, item -> {
            throw new IllegalStateException("flaky");
        });

        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruptedProcessor_failsWithoutRetry() {
        BatchOutcome<String> outcome = retryController.execute(ITEM, item -> {
            throw new InterruptedException();
        });

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.errorMessage()).isEqualTo("Processing interrupted");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void interruptedBackoff_reportsLastErrorSeen() {
        RetryController interruptedSleep = new RetryController(BatchSettings.defaults(), new ErrorClassifier(),
                millis -> {
                    throw new InterruptedException();
                });

        BatchOutcome<String> outcome = interruptedSleep.execute(ITEM, item -> {
            throw ItemProcessingException.transientFailure("SCRAPER_TIMEOUT", "slow", null);
        });

        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(outcome.errorMessage()).isEqualTo("[SCRAPER_TIMEOUT] slow");
    }
}
