package com.flagship.wallet_ledger.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.wallet_ledger.ledger.exception.ErrorCode;
import com.flagship.wallet_ledger.ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

/**
 * Maps every failure to a stable {@link ErrorResponse}. The {@code error}
 * field is always an {@link ErrorCode} name.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException e) {
        ErrorCode code = e.getErrorCode();
        if (code == ErrorCode.INTERNAL_ERROR) {
            log.error("Ledger error: {}", e.getMessage(), e);
        } else {
            log.warn("Request rejected: code={}, message={}", code, e.getMessage());
        }
        return respond(code.getHttpStatus(), code, e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter: {}", e.getName());
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                "Invalid value for parameter '" + e.getName() + "'",
                Map.of(e.getName(), "Invalid format"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                "Required parameter '" + e.getParameterName() + "' is missing",
                Map.of(e.getParameterName(), "Required"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                "Malformed request body", null);
    }

    /**
     * Store unavailable, lock wait or unit-of-work timeout. Safe to retry with
     * the same idempotency key.
     */
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleStoreFailure(RuntimeException e) {
        log.error("Store failure: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.INTERNAL_ERROR,
                "Ledger store temporarily unavailable", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR,
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorCode code,
                                                  String message, Map<String, String> details) {
        ErrorResponse error = ErrorResponse.builder()
            .error(code.name())
            .message(message)
            .retryable(code.isRetryable())
            .details(details == null || details.isEmpty() ? null : details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }

    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String message;
        boolean retryable;
        Map<String, String> details;
        Instant timestamp;
    }
}
