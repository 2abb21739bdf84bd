package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.reference.AssetTypeEntity;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class AssetTypeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("description")
    String description;

    public static AssetTypeResponse from(AssetTypeEntity entity) {
        return AssetTypeResponse.builder()
            .id(entity.getId())
            .name(entity.getName())
            .symbol(entity.getSymbol())
            .description(entity.getDescription())
            .build();
    }
}
