package com.oslira.bulk.controller;

import com.oslira.bulk.model.BatchProgress;
import com.oslira.bulk.model.BatchSubmission;
import com.oslira.bulk.model.BulkAnalysisRequest;
import com.oslira.bulk.service.BulkAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bulk lead analysis.
 *
 * POST /api/leads/analyze/bulk                     → queue a run (202)
 * GET  /api/leads/analyze/bulk/{batchId}/progress  → poll a run
 * POST /api/leads/analyze/bulk/{batchId}/cancel    → stop a run after its current group
 */
@RestController
@RequestMapping("/api/leads/analyze")
@Slf4j
@RequiredArgsConstructor
public class BulkAnalysisController {

    private final BulkAnalysisService bulkAnalysisService;

    /**
     * Queue up to 50 usernames for analysis. Validation and the credit check happen
     * before the 202; the final result appears in the progress response.
     * Only successful analyses are charged.
     */
    @PostMapping("/bulk")
    public ResponseEntity<BatchSubmission> analyzeBulk(@RequestBody BulkAnalysisRequest request) {
        log.info("Bulk analysis request received: {} profiles ({})",
                request.usernames() != null ? request.usernames().size() : 0, request.analysisType());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(bulkAnalysisService.submit(request));
    }

    @GetMapping("/bulk/{batchId}/progress")
    public ResponseEntity<BatchProgress> getProgress(@PathVariable String batchId) {
        return ResponseEntity.ok(bulkAnalysisService.progress(batchId));
    }

    @PostMapping("/bulk/{batchId}/cancel")
    public ResponseEntity<BatchProgress> cancel(@PathVariable String batchId) {
        log.info("Cancel request received for batch {}", batchId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(bulkAnalysisService.cancel(batchId));
    }
}
