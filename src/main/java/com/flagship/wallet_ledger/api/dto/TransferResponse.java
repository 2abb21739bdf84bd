package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.ledger.TransferResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    String amount;

    /** Only present for spends. */
    @JsonProperty("remaining_balance")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String remainingBalance;

    @JsonProperty("replay")
    boolean replay;

    public static TransferResponse from(TransferResult result) {
        return TransferResponse.builder()
            .transactionId(result.getTransactionId())
            .type(result.getType())
            .amount(result.getAmount().toPlainString())
            .remainingBalance(result.getRemainingBalance() != null
                ? result.getRemainingBalance().toPlainString()
                : null)
            .replay(result.isReplay())
            .build();
    }
}
