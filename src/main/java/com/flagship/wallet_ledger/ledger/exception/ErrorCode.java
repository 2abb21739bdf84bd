package com.flagship.wallet_ledger.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error signals of the ledger.
 *
 * {@code retryable} tells a caller whether resubmitting the same request
 * (with the same idempotency key) can succeed. Validation, not-found and
 * insufficient-funds failures repeat deterministically; conflicts and
 * internal failures do not.
 */
public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY, false),
    CONFLICT(HttpStatus.CONFLICT, true),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, true);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorCode(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
