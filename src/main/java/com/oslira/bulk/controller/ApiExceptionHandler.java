package com.oslira.bulk.controller;

import com.oslira.bulk.exception.AccountNotFoundException;
import com.oslira.bulk.exception.BatchAlreadyFinishedException;
import com.oslira.bulk.exception.BatchNotFoundException;
import com.oslira.bulk.exception.InsufficientCreditsException;
import com.oslira.bulk.exception.InvalidBulkRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps request-level failures to {"error", "code"} bodies.
 * Individual item failures never reach here; they are part of the bulk result.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidBulkRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidBulkRequestException e) {
        log.warn("Rejected bulk request [{}]: {}", e.getCode(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), e.getCode());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed JSON request body", "VALIDATION_ERROR");
    }

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientCredits(InsufficientCreditsException e) {
        log.warn("Insufficient credits for account {}: need {}, have {}",
                e.getAccountId(), e.getRequired(), e.getAvailable());
        ResponseEntity<Map<String, Object>> response =
                error(HttpStatus.PAYMENT_REQUIRED, e.getMessage(), "INSUFFICIENT_CREDITS");
        response.getBody().put("required", e.getRequired());
        response.getBody().put("available", e.getAvailable());
        return response;
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleAccountNotFound(AccountNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), "NOT_FOUND");
    }

    @ExceptionHandler(BatchNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleBatchNotFound(BatchNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), "NOT_FOUND");
    }

    @ExceptionHandler(BatchAlreadyFinishedException.class)
    public ResponseEntity<Map<String, Object>> handleBatchAlreadyFinished(BatchAlreadyFinishedException e) {
        log.warn("Cancel ignored for batch {}: already {}", e.getBatchId(), e.getStatus());
        ResponseEntity<Map<String, Object>> response =
                error(HttpStatus.CONFLICT, e.getMessage(), "BATCH_ALREADY_FINISHED");
        response.getBody().put("status", e.getStatus());
        return response;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
