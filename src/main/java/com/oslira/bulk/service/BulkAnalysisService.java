package com.oslira.bulk.service;

import com.oslira.bulk.config.AppMetrics;
import com.oslira.bulk.config.TraceContextManager;
import com.oslira.bulk.exception.BatchAlreadyFinishedException;
import com.oslira.bulk.exception.BatchNotFoundException;
import com.oslira.bulk.exception.InsufficientCreditsException;
import com.oslira.bulk.exception.InvalidBulkRequestException;
import com.oslira.bulk.model.BatchProgress;
import com.oslira.bulk.model.BatchRunStatus;
import com.oslira.bulk.model.BatchSubmission;
import com.oslira.bulk.model.BatchSummary;
import com.oslira.bulk.model.BulkAnalysisRequest;
import com.oslira.bulk.model.BulkAnalysisResult;
import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.CostLedgerEntry;
import com.oslira.bulk.model.LedgerUpdate;
import com.oslira.bulk.model.ProfileAnalysis;
import com.oslira.bulk.model.ProfileStatus;
import com.oslira.bulk.model.WorkItem;
import com.oslira.bulk.repository.CreditLedger;
import com.oslira.bulk.service.analysis.ProfileAnalyzer;
import com.oslira.bulk.service.batch.BatchProcessingEngine;
import com.oslira.bulk.service.batch.CancellationToken;
import com.oslira.bulk.service.batch.ProgressListener;
import com.oslira.bulk.service.billing.CostTable;
import com.oslira.bulk.service.billing.CreditReconciler;
import com.oslira.bulk.service.tracking.BatchRun;
import com.oslira.bulk.service.tracking.BatchRunRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a bulk profile analysis request end to end.
 *
 * Stages:
 * 1. Validate the request and check the account can cover the worst case
 * 2. Run the batch engine over every username
 * 3. Reconcile credits from successful analyses only
 * 4. Record usage in the credit ledger; a ledger failure is logged, never fatal
 *
 * {@link #submit} does stage 1 on the caller's thread and the rest on a run thread,
 * tracked in the {@link BatchRunRegistry}. {@link #analyze} does all four inline.
 */
@Service
@Slf4j
public class BulkAnalysisService {

    static final String TRANSACTION_TYPE = "bulk_analysis_run";
    static final String PROGRESS_URL = "/api/leads/analyze/bulk/%s/progress";

    private final BatchProcessingEngine engine;
    private final CreditReconciler reconciler;
    private final CostTable costTable;
    private final CreditLedger creditLedger;
    private final ProfileAnalyzer profileAnalyzer;
    private final BatchRunRegistry runRegistry;
    private final ExecutorService runExecutor;
    private final AppMetrics metrics;
    private final int maxProfiles;

    public BulkAnalysisService(
            BatchProcessingEngine engine,
            CreditReconciler reconciler,
            CostTable costTable,
            CreditLedger creditLedger,
            ProfileAnalyzer profileAnalyzer,
            BatchRunRegistry runRegistry,
            @Qualifier("batchRunExecutor") ExecutorService runExecutor,
            AppMetrics metrics,
            @Value("${app.bulk.max-profiles:50}") int maxProfiles) {
        this.engine = engine;
        this.reconciler = reconciler;
        this.costTable = costTable;
        this.creditLedger = creditLedger;
        this.profileAnalyzer = profileAnalyzer;
        this.runRegistry = runRegistry;
        this.runExecutor = runExecutor;
        this.metrics = metrics;
        this.maxProfiles = maxProfiles;
    }

    /**
     * Validate and queue a run, returning as soon as it is tracked.
     *
     * @throws InvalidBulkRequestException   if the request is malformed
     * @throws InsufficientCreditsException  if the balance cannot cover every requested profile
     */
    public BatchSubmission submit(BulkAnalysisRequest request) {
        PreparedRun prepared = prepare(request);
        BatchRun run = runRegistry.register(request.accountId(), prepared.analysisType().code(),
                prepared.usernames().size());
        log.info("Queued bulk {} analysis {} for account {}: {} profiles",
                prepared.analysisType().code(), run.getBatchId(), request.accountId(), prepared.usernames().size());

        try {
            CompletableFuture.runAsync(() -> executeTracked(prepared, run), runExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Batch {} could not be queued: {}", run.getBatchId(), e.getMessage());
            run.fail("Run queue unavailable");
            throw e;
        }

        return new BatchSubmission(
                run.getBatchId(),
                prepared.analysisType().code(),
                prepared.usernames().size(),
                prepared.creditsNeeded(),
                BatchRunStatus.QUEUED.code(),
                String.format(PROGRESS_URL, run.getBatchId()),
                "Bulk analysis queued");
    }

    /**
     * Run a request to completion on the calling thread.
     *
     * @throws InvalidBulkRequestException   if the request is malformed
     * @throws InsufficientCreditsException  if the balance cannot cover every requested profile
     */
    public BulkAnalysisResult analyze(BulkAnalysisRequest request) {
        PreparedRun prepared = prepare(request);
        String batchId = TraceContextManager.bindNewBatch();
        try {
            return runBatch(prepared, batchId,
                    (completed, total) -> log.debug("Progress: {}/{}", completed, total),
                    CancellationToken.NONE);
        } finally {
            TraceContextManager.clearBatch();
        }
    }

    /**
     * @throws BatchNotFoundException if the batch is unknown or expired
     */
    public BatchProgress progress(String batchId) {
        return runRegistry.require(checkBatchId(batchId)).snapshot();
    }

    /**
     * Ask a run to stop after the group in flight. Items already dispatched still finish and are charged.
     *
     * @throws BatchNotFoundException        if the batch is unknown or expired
     * @throws BatchAlreadyFinishedException if the run already finished
     */
    public BatchProgress cancel(String batchId) {
        return runRegistry.cancel(checkBatchId(batchId)).snapshot();
    }

    private void executeTracked(PreparedRun prepared, BatchRun run) {
        TraceContextManager.bindBatch(run.getBatchId());
        try {
            if (!run.start()) {
                log.info("Batch {} cancelled before it started", run.getBatchId());
                metrics.incrementRunsCancelled();
                return;
            }
            BulkAnalysisResult result = runBatch(prepared, run.getBatchId(), run, run);
            boolean skippedItems = run.isCancellationRequested()
                    && result.profiles().stream().anyMatch(profile -> profile.attempts() == 0);
            run.complete(result, skippedItems);
            if (skippedItems) {
                metrics.incrementRunsCancelled();
            }
        } catch (RuntimeException e) {
            log.error("Batch {} failed: {}", run.getBatchId(), e.getMessage(), e);
            run.fail(e.getMessage());
        } finally {
            TraceContextManager.clearBatch();
        }
    }

    private BulkAnalysisResult runBatch(PreparedRun prepared, String batchId,
                                        ProgressListener listener, CancellationToken cancellation) {
        BulkAnalysisRequest request = prepared.request();
        ComplexityClass analysisType = prepared.analysisType();
        int available = prepared.available();
        log.info("Bulk {} analysis for account {}: {} profiles, up to {} credits (balance {})",
                analysisType.code(), request.accountId(), prepared.usernames().size(),
                prepared.creditsNeeded(), available);

        List<WorkItem> items = prepared.usernames().stream()
                .map(username -> new WorkItem(username, analysisType))
                .toList();

        BatchSummary<ProfileAnalysis> summary = engine.processBatch(items, analysisType,
                item -> profileAnalyzer.analyze(item, request.businessProfileId()),
                listener, cancellation);

        CostLedgerEntry cost = reconciler.reconcile(summary, costTable);
        OptionalInt balance = recordUsage(request.accountId(), analysisType, cost, available);

        log.info("Bulk analysis {} done: {} successful, {} failed, {} credits used",
                batchId, summary.successful(), summary.failed(), cost.creditsCharged());

        return new BulkAnalysisResult(
                batchId,
                analysisType.code(),
                summary.total(),
                summary.successful(),
                summary.failed(),
                summary.totalDurationMs(),
                summary.results().stream().map(ProfileStatus::from).toList(),
                cost.creditsCharged(),
                balance.orElse(available),
                cost,
                summary.statistics(),
                balance.isPresent()
        );
    }

    private PreparedRun prepare(BulkAnalysisRequest request) {
        ComplexityClass analysisType = validate(request);
        List<String> usernames = request.usernames().stream().map(String::trim).toList();

        int creditsNeeded = costTable.creditsFor(analysisType, usernames.size());
        int available = creditLedger.availableCredits(request.accountId());
        if (available < creditsNeeded) {
            throw new InsufficientCreditsException(request.accountId(), creditsNeeded, available);
        }
        return new PreparedRun(request, analysisType, usernames, creditsNeeded, available);
    }

    /**
     * @return the ledger's balance after the deduction, the pre-run balance when nothing was charged,
     *         or empty if the ledger update failed
     */
    private OptionalInt recordUsage(String accountId, ComplexityClass analysisType, CostLedgerEntry cost,
                                    int available) {
        if (cost.creditsCharged() <= 0) {
            return OptionalInt.of(available);
        }
        LedgerUpdate update = new LedgerUpdate(
                accountId,
                cost.creditsCharged(),
                cost.actualCost(),
                "Bulk " + analysisType.code() + " analysis - " + cost.billableItems() + " profiles",
                TRANSACTION_TYPE);
        try {
            int balanceAfter = creditLedger.recordUsage(update);
            metrics.incrementCreditsCharged(cost.creditsCharged());
            return OptionalInt.of(balanceAfter);
        } catch (RuntimeException e) {
            log.error("Bulk credit update failed for account {} ({} credits): {}",
                    accountId, cost.creditsCharged(), e.getMessage(), e);
            metrics.incrementLedgerFailures();
            return OptionalInt.empty();
        }
    }

    private static String checkBatchId(String batchId) {
        if (batchId == null || !batchId.startsWith(TraceContextManager.BATCH_ID_PREFIX)) {
            throw invalid("batchId must start with \"" + TraceContextManager.BATCH_ID_PREFIX + "\"");
        }
        return batchId;
    }

    private ComplexityClass validate(BulkAnalysisRequest request) {
        if (request == null) {
            throw invalid("request body is required");
        }
        if (isBlank(request.accountId())) {
            throw invalid("accountId is required");
        }
        if (isBlank(request.businessProfileId())) {
            throw invalid("businessProfileId is required");
        }
        List<String> usernames = request.usernames();
        if (usernames == null || usernames.isEmpty()) {
            throw invalid("usernames array is required and cannot be empty");
        }
        if (usernames.size() > maxProfiles) {
            throw invalid("Maximum " + maxProfiles + " profiles per bulk request");
        }
        Set<String> seen = new HashSet<>();
        for (String username : usernames) {
            if (isBlank(username)) {
                throw invalid("usernames must not be blank");
            }
            if (!seen.add(username.trim())) {
                throw new InvalidBulkRequestException("DUPLICATE_USERNAMES", "Duplicate usernames in request");
            }
        }
        try {
            return ComplexityClass.fromCode(request.analysisType());
        } catch (IllegalArgumentException e) {
            throw invalid(e.getMessage());
        }
    }

    private static InvalidBulkRequestException invalid(String message) {
        return new InvalidBulkRequestException("VALIDATION_ERROR", message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record PreparedRun(
            BulkAnalysisRequest request,
            ComplexityClass analysisType,
            List<String> usernames,
            int creditsNeeded,
            int available
    ) {}
}
