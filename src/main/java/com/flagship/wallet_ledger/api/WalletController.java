package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.BalanceResponse;
import com.flagship.wallet_ledger.api.dto.TransactionHistoryResponse;
import com.flagship.wallet_ledger.api.dto.TransferRequestBody;
import com.flagship.wallet_ledger.api.dto.TransferResponse;
import com.flagship.wallet_ledger.api.validation.TransferRequestValidator;
import com.flagship.wallet_ledger.api.validation.ValidationResult;
import com.flagship.wallet_ledger.ledger.LedgerQueryService;
import com.flagship.wallet_ledger.ledger.TransactionCoordinator;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.ledger.TransferResult;
import com.flagship.wallet_ledger.ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST surface for transfers and wallet reads.
 *
 * A new transfer answers 201 Created; a request whose idempotency key was
 * already committed answers 200 OK with the original result.
 */
@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final TransactionCoordinator transactionCoordinator;
    private final LedgerQueryService ledgerQueryService;
    private final TransferRequestValidator transferRequestValidator;

    @PostMapping("/topup")
    public ResponseEntity<TransferResponse> topUp(@RequestBody TransferRequestBody body) {
        return transfer(TransactionType.TOPUP, body);
    }

    @PostMapping("/bonus")
    public ResponseEntity<TransferResponse> bonus(@RequestBody TransferRequestBody body) {
        return transfer(TransactionType.BONUS, body);
    }

    @PostMapping("/spend")
    public ResponseEntity<TransferResponse> spend(@RequestBody TransferRequestBody body) {
        return transfer(TransactionType.SPEND, body);
    }

    @GetMapping("/{userId}/balance")
    public BalanceResponse getBalance(@PathVariable UUID userId,
                                      @RequestParam("asset_type_id") UUID assetTypeId) {
        return BalanceResponse.from(ledgerQueryService.getBalance(userId, assetTypeId));
    }

    @GetMapping("/{userId}/transactions")
    public List<TransactionHistoryResponse> getHistory(@PathVariable UUID userId,
                                                       @RequestParam(value = "asset_type_id", required = false) UUID assetTypeId) {
        return ledgerQueryService.getHistory(userId, assetTypeId).stream()
                .map(TransactionHistoryResponse::from)
                .toList();
    }

    private ResponseEntity<TransferResponse> transfer(TransactionType type, TransferRequestBody body) {
        ValidationResult validation = transferRequestValidator.validate(body);
        if (!validation.isValid()) {
            throw new ValidationException("Request validation failed", validation.getErrors());
        }

        TransferResult result = transactionCoordinator.execute(type, validation.getCommand());
        log.debug("{} handled: txId={}, replay={}", type, result.getTransactionId(), result.isReplay());

        HttpStatus status = result.isReplay() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransferResponse.from(result));
    }
}
