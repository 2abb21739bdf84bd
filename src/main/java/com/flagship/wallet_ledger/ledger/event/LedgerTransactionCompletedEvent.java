package com.flagship.wallet_ledger.ledger.event;

import com.flagship.wallet_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published through the outbox once a transfer's unit of work commits.
 * Keyed by transaction id on the wire.
 */
@Value
public class LedgerTransactionCompletedEvent {

    public static final String EVENT_TYPE = "LedgerTransactionCompleted";
    public static final String AGGREGATE_TYPE = "LedgerTransaction";

    UUID eventId;
    UUID transactionId;
    UUID entryId;
    String transactionType;
    UUID userId;
    UUID assetTypeId;
    UUID debitWalletId;
    UUID creditWalletId;
    BigDecimal amount;
    String idempotencyKey;
    Instant occurredAt;

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerTransactionCompletedEvent fromEntry(LedgerEntry entry, UUID userId) {
        return new LedgerTransactionCompletedEvent(
            UUID.randomUUID(),
            entry.getTransactionId(),
            entry.getId(),
            entry.getTransactionType().name(),
            userId,
            entry.getAssetTypeId(),
            entry.getDebitWalletId(),
            entry.getCreditWalletId(),
            entry.getAmount(),
            entry.getIdempotencyKey(),
            Instant.now()
        );
    }
}
