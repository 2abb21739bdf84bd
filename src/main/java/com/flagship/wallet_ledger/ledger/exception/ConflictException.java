package com.flagship.wallet_ledger.ledger.exception;

import java.util.Map;

/**
 * Another request committed an entry under the same idempotency key first.
 * The coordinator normally turns this into a replay; it only reaches a caller
 * when the winning entry cannot be read back.
 */
public class ConflictException extends LedgerException {

    private final String idempotencyKey;

    public ConflictException(String idempotencyKey, Throwable cause) {
        super(ErrorCode.CONFLICT,
                "Duplicate request detected for idempotency key: " + idempotencyKey,
                Map.of("idempotency_key", idempotencyKey),
                cause);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
