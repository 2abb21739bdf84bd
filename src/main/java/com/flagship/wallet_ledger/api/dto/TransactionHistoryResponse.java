package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.HistoryItem;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionHistoryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("debit_wallet_id")
    UUID debitWalletId;

    @JsonProperty("credit_wallet_id")
    UUID creditWalletId;

    public static TransactionHistoryResponse from(HistoryItem item) {
        return TransactionHistoryResponse.builder()
            .id(item.getEntryId())
            .transactionId(item.getTransactionId())
            .type(item.getType())
            .status(item.getStatus())
            .amount(item.getAmount().toPlainString())
            .description(item.getDescription())
            .createdAt(item.getCreatedAt())
            .debitWalletId(item.getDebitWalletId())
            .creditWalletId(item.getCreditWalletId())
            .build();
    }
}
