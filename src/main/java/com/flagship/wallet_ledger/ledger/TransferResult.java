package com.flagship.wallet_ledger.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of a committed transfer. Serialized as-is into the idempotency
 * cache, so a replay returns exactly what the first call returned apart from
 * the {@code replay} flag.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TransferResult {
    UUID transactionId;
    TransactionType type;
    BigDecimal amount;
    /** Spender's balance after a SPEND; null for TOPUP and BONUS. */
    BigDecimal remainingBalance;
    boolean replay;

    public TransferResult asReplay() {
        return toBuilder().replay(true).build();
    }
}
