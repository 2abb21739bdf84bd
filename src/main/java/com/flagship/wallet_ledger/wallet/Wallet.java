package com.flagship.wallet_ledger.wallet;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One account per (user, asset type). Holds no balance: the balance is
 * always derived from ledger entries by {@link BalanceCalculator}.
 */
@Value
public class Wallet {
    UUID id;
    UUID userId;
    UUID assetTypeId;
    Instant createdAt;
}
