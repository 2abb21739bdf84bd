package com.flagship.wallet_ledger.ledger.exception;

import java.util.Map;

/**
 * Base class of every failure the ledger reports on purpose.
 * Anything else reaching a caller is an internal error.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    protected LedgerException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected LedgerException(ErrorCode errorCode, String message, Map<String, String> details) {
        this(errorCode, message, details, null);
    }

    protected LedgerException(ErrorCode errorCode, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
