package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body shared by the top-up, bonus and spend endpoints.
 * The transfer kind comes from the path, not the body.
 */
@Value
@Builder
@Jacksonized
public class TransferRequestBody {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    UUID userId;

    @NotNull(message = "Asset type ID is required")
    @JsonProperty("asset_type_id")
    UUID assetTypeId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be positive")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Idempotency key is required")
    @Size(max = 255, message = "Idempotency key must be at most 255 characters")
    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;
}
