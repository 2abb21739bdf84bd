package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.BalanceView;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("asset_type_id")
    UUID assetTypeId;

    @JsonProperty("asset_name")
    String assetName;

    @JsonProperty("asset_symbol")
    String assetSymbol;

    /** Fixed 4 fractional digits, e.g. "1000.0000". */
    @JsonProperty("balance")
    String balance;

    public static BalanceResponse from(BalanceView view) {
        return BalanceResponse.builder()
            .userId(view.getUserId())
            .assetTypeId(view.getAssetTypeId())
            .assetName(view.getAssetName())
            .assetSymbol(view.getAssetSymbol())
            .balance(view.getBalance().toPlainString())
            .build();
    }
}
