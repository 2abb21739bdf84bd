package com.flagship.wallet_ledger.ledger;

/**
 * Lifecycle of a transaction row. A transaction is written PENDING and sealed
 * COMPLETED in the same unit of work, so only COMPLETED is ever visible
 * after commit.
 */
public enum TransactionStatus {
    PENDING,
    COMPLETED
}
