package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.ledger.event.LedgerTransactionCompletedEvent;
import com.flagship.wallet_ledger.ledger.exception.ConflictException;
import com.flagship.wallet_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.ledger.exception.LedgerException;
import com.flagship.wallet_ledger.ledger.exception.ValidationException;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import com.flagship.wallet_ledger.reference.ReferenceDataService;
import com.flagship.wallet_ledger.reference.UserAccountEntity;
import com.flagship.wallet_ledger.wallet.BalanceCalculator;
import com.flagship.wallet_ledger.wallet.LockCoordinator;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes top-ups, bonuses and spends as single atomic units.
 *
 * Each transfer:
 * 1. Is rejected up front if the amount or idempotency key is malformed
 * 2. Returns the committed result if its idempotency key was already used
 * 3. Resolves the user and treasury wallets, creating them on first use
 * 4. Locks both wallets in global lock order
 * 5. For a SPEND, checks the user's derived balance under that lock
 * 6. Writes the transaction, its ledger entry and an outbox event, then commits
 *
 * Any failure inside the unit rolls all of it back. The key is checked again
 * once the locks are held, so a same-key request that committed in the
 * meantime is returned as a replay before any balance check. A unique-key
 * violation on the entry means a concurrent request with the same key won the
 * race on another pair of wallets; its committed result is returned as a
 * replay as well.
 */
@Service
@Slf4j
public class TransactionCoordinator {

    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final TransactionTemplate ledgerTransactionTemplate;
    private final ReferenceDataService referenceDataService;
    private final WalletRegistry walletRegistry;
    private final LockCoordinator lockCoordinator;
    private final BalanceCalculator balanceCalculator;
    private final LedgerRepository ledgerRepository;
    private final IdempotencyGuard idempotencyGuard;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    public TransactionCoordinator(@Qualifier("ledgerTransactionTemplate") TransactionTemplate ledgerTransactionTemplate,
                                  ReferenceDataService referenceDataService,
                                  WalletRegistry walletRegistry,
                                  LockCoordinator lockCoordinator,
                                  BalanceCalculator balanceCalculator,
                                  LedgerRepository ledgerRepository,
                                  IdempotencyGuard idempotencyGuard,
                                  OutboxService outboxService,
                                  LedgerMetrics ledgerMetrics) {
        this.ledgerTransactionTemplate = ledgerTransactionTemplate;
        this.referenceDataService = referenceDataService;
        this.walletRegistry = walletRegistry;
        this.lockCoordinator = lockCoordinator;
        this.balanceCalculator = balanceCalculator;
        this.ledgerRepository = ledgerRepository;
        this.idempotencyGuard = idempotencyGuard;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
    }

    public TransferResult topUp(TransferCommand command) {
        return execute(TransactionType.TOPUP, command);
    }

    public TransferResult bonus(TransferCommand command) {
        return execute(TransactionType.BONUS, command);
    }

    public TransferResult spend(TransferCommand command) {
        return execute(TransactionType.SPEND, command);
    }

    /**
     * Runs one transfer of the given kind.
     *
     * @throws ValidationException malformed input, or a transfer on the treasury itself
     * @throws com.flagship.wallet_ledger.ledger.exception.NotFoundException unknown user or asset type
     * @throws InsufficientFundsException SPEND larger than the user's balance
     * @throws ConflictException lost an idempotency race and the winner cannot be read
     */
    public TransferResult execute(TransactionType type, TransferCommand command) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.IDEMPOTENCY_KEY_MDC_KEY, command.getIdempotencyKey());

        try {
            BigDecimal amount = validate(command);

            Optional<TransferResult> replay = idempotencyGuard.checkReplay(command.getIdempotencyKey());
            if (replay.isPresent()) {
                warnOnMismatchedReplay(type, amount, replay.get());
                ledgerMetrics.recordTransfer(type.name(), "replay");
                log.info("Returning committed result for replayed request: txId={}", replay.get().getTransactionId());
                return replay.get();
            }

            TransferResult result;
            try {
                result = ledgerTransactionTemplate.execute(status -> transfer(type, command, amount));
            } catch (ConflictException e) {
                result = idempotencyGuard.checkReplay(command.getIdempotencyKey())
                    .orElseThrow(() -> e);
            }

            idempotencyGuard.remember(command.getIdempotencyKey(), result);

            long duration = System.currentTimeMillis() - startTime;
            if (result.isReplay()) {
                ledgerMetrics.recordTransfer(type.name(), "replay");
                ledgerMetrics.recordTransferLatency(type.name(), duration);
                log.info("Lost idempotency race, returning winner's result: txId={}", result.getTransactionId());
                return result;
            }

            ledgerMetrics.recordTransfer(type.name(), "success");
            ledgerMetrics.recordTransferLatency(type.name(), duration);
            log.info("Transfer committed: type={}, txId={}, amount={}, duration={}ms",
                    type, result.getTransactionId(), amount, duration);

            return result;

        } catch (LedgerException e) {
            ledgerMetrics.recordTransfer(type.name(), e.getErrorCode().name().toLowerCase());
            log.warn("Transfer rejected: type={}, error={}, message={}", type, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordTransfer(type.name(), "error");
            ledgerMetrics.recordTransferLatency(type.name(), duration);
            log.error("Transfer failed: type={}, error={}, duration={}ms", type, e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.IDEMPOTENCY_KEY_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private TransferResult transfer(TransactionType type, TransferCommand command, BigDecimal amount) {
        referenceDataService.requireAssetType(command.getAssetTypeId());
        UserAccountEntity user = referenceDataService.requireUser(command.getUserId());
        if (user.isSystem()) {
            throw new ValidationException("Transfers on the treasury account itself are not allowed");
        }

        Wallet userWallet = walletRegistry.resolve(command.getUserId(), command.getAssetTypeId());
        Wallet treasuryWallet = walletRegistry.resolveTreasury(command.getAssetTypeId());

        lockCoordinator.lockInOrder(List.of(userWallet.getId(), treasuryWallet.getId()));

        // A same-key request may have committed while this one waited for the locks
        Optional<LedgerEntry> committed = ledgerRepository.findEntryByIdempotencyKey(command.getIdempotencyKey());
        if (committed.isPresent()) {
            return IdempotencyGuard.toResult(committed.get()).asReplay();
        }

        Wallet debit = type.issuesValue() ? treasuryWallet : userWallet;
        Wallet credit = type.issuesValue() ? userWallet : treasuryWallet;

        BigDecimal remainingBalance = null;
        if (type == TransactionType.SPEND) {
            BigDecimal available = balanceCalculator.balanceOf(userWallet.getId());
            if (available.compareTo(amount) < 0) {
                throw new InsufficientFundsException(userWallet.getId(), available, amount);
            }
            remainingBalance = available.subtract(amount);
        }

        String amountText = amount.toPlainString();
        boolean hasDescription = command.getDescription() != null && !command.getDescription().isBlank();

        UUID transactionId = ledgerRepository.insertTransaction(type,
            hasDescription ? command.getDescription() : type.defaultTransactionDescription(amountText));
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());

        LedgerEntry entry = ledgerRepository.appendEntry(
            transactionId,
            command.getAssetTypeId(),
            debit.getId(),
            credit.getId(),
            amount,
            type,
            hasDescription ? command.getDescription() : type.defaultEntryDescription(),
            command.getIdempotencyKey(),
            remainingBalance != null
                ? Map.of(LedgerEntry.BALANCE_AFTER, remainingBalance.toPlainString())
                : Map.of()
        );

        ledgerRepository.markCompleted(transactionId);

        outboxService.saveEvent(LedgerTransactionCompletedEvent.AGGREGATE_TYPE, transactionId,
                LedgerTransactionCompletedEvent.EVENT_TYPE,
                LedgerTransactionCompletedEvent.fromEntry(entry, command.getUserId()));

        log.debug("Appended entry: entryId={}, debit={}, credit={}", entry.getId(), debit.getId(), credit.getId());

        return TransferResult.builder()
            .transactionId(transactionId)
            .type(type)
            .amount(amount)
            .remainingBalance(remainingBalance)
            .replay(false)
            .build();
    }

    /**
     * Checks the command and returns its amount at ledger scale.
     */
    private BigDecimal validate(TransferCommand command) {
        if (command.getUserId() == null) {
            throw new ValidationException("User ID is required");
        }
        if (command.getAssetTypeId() == null) {
            throw new ValidationException("Asset type ID is required");
        }
        String key = command.getIdempotencyKey();
        if (key == null || key.isBlank()) {
            throw new ValidationException("Idempotency key is required");
        }
        if (key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new ValidationException("Idempotency key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        if (command.getAmount() == null) {
            throw new ValidationException("Amount is required");
        }

        BigDecimal amount = BalanceCalculator.quantize(command.getAmount());
        if (amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        if (amount.precision() - amount.scale() > BalanceCalculator.MAX_INTEGER_DIGITS) {
            throw new ValidationException("Amount exceeds the maximum supported value");
        }
        return amount;
    }

    private void warnOnMismatchedReplay(TransactionType type, BigDecimal amount, TransferResult replay) {
        if (replay.getType() != type || replay.getAmount().compareTo(amount) != 0) {
            log.warn("Idempotency key reused with different parameters: original type={} amount={}, " +
                    "request type={} amount={}", replay.getType(), replay.getAmount(), type, amount);
        }
    }
}
