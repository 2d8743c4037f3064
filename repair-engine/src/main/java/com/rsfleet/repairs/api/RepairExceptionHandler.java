package com.rsfleet.repairs.api;

import com.rsfleet.repairs.error.ConcurrencyException;
import com.rsfleet.repairs.error.RepairEngineException;
import com.rsfleet.repairs.error.RepairNotFoundException;
import com.rsfleet.repairs.error.TransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine failures to HTTP responses.
 *
 * Body: { "error": ..., "kind": ..., "retryable": ..., "timestamp": ... }
 * Transition failures also carry "from" and "to".
 */
@RestControllerAdvice
public class RepairExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RepairExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(RepairEngineException.class)
    public ResponseEntity<Map<String, Object>> handleEngineException(RepairEngineException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case VALIDATION    -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case TRANSITION    -> HttpStatus.CONFLICT;
            case CONCURRENCY   -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERSISTENCE   -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.debug("Request rejected with {}: {}", ex.getKind(), ex.getMessage());

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (ex.isRetryable()) {
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        Map<String, Object> body = body(ex.getMessage(), ex.getKind().name(), ex.isRetryable());
        if (ex instanceof TransitionException te && te.getFrom() != null) {
            body.put("from", te.getFrom().name());
            body.put("to",   te.getTo().name());
        }
        return response.body(body);
    }

    /**
     * A transaction that could not be opened or committed, most often because
     * the connection pool is exhausted. Nothing was written, so the client may retry.
     */
    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<Map<String, Object>> handleTransactionFailure(TransactionException ex) {
        log.warn("Transaction failure: {}", ex.getMessage());
        return handleEngineException(
                new ConcurrencyException("The repair store is busy; retry the request", ex));
    }

    @ExceptionHandler(RepairNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(RepairNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(ex.getMessage(), "NOT_FOUND", false));
    }

    private static Map<String, Object> body(String message, String kind, boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("kind", kind);
        body.put("retryable", retryable);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
