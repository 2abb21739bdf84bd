package com.flagship.wallet_ledger.ledger.exception;

import java.util.Map;

/**
 * Malformed or non-positive amount, malformed identifier or idempotency key.
 * Raised before the store is touched.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(ErrorCode.VALIDATION_ERROR, message, fieldErrors);
    }
}
