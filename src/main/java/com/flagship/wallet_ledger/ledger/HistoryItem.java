package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A ledger entry joined with the status of its transaction.
 */
@Value
public class HistoryItem {
    UUID entryId;
    UUID transactionId;
    UUID assetTypeId;
    TransactionType type;
    TransactionStatus status;
    BigDecimal amount;
    String description;
    Instant createdAt;
    UUID debitWalletId;
    UUID creditWalletId;
}
