package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable movement of {@code amount} from the debit wallet to the
 * credit wallet. Entries are never updated or deleted; a correction is a new
 * offsetting entry.
 */
@Value
public class LedgerEntry {

    /** Metadata key holding the spender's balance right after a SPEND. */
    public static final String BALANCE_AFTER = "balance_after";

    UUID id;
    UUID transactionId;
    UUID assetTypeId;
    UUID debitWalletId;
    UUID creditWalletId;
    BigDecimal amount;
    TransactionType transactionType;
    String description;
    String idempotencyKey;
    Map<String, String> metadata;
    Instant createdAt;
    Long sequenceNumber;
}
