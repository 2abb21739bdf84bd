package com.flagship.wallet_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A validated request to move value between a user and the treasury.
 * The kind is chosen by the coordinator operation it is passed to.
 */
@Value
@Builder
public class TransferCommand {
    UUID userId;
    UUID assetTypeId;
    BigDecimal amount;
    String idempotencyKey;
    String description;
}
