package com.flagship.wallet_ledger.ledger.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * A SPEND asked for more than the wallet's derived balance.
 * Carries both figures so the caller can show what is available.
 */
public class InsufficientFundsException extends LedgerException {

    private final UUID walletId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(UUID walletId, BigDecimal available, BigDecimal requested) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient balance. Available: %s, Required: %s",
                        available.toPlainString(), requested.toPlainString()),
                Map.of("available", available.toPlainString(),
                        "requested", requested.toPlainString()));
        this.walletId = walletId;
        this.available = available;
        this.requested = requested;
    }

    public UUID getWalletId() {
        return walletId;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
