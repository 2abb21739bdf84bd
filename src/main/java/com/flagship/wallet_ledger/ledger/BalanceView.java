package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BalanceView {
    UUID userId;
    UUID assetTypeId;
    String assetName;
    String assetSymbol;
    BigDecimal balance;
}
