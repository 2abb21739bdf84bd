package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.AbstractIntegrationTest;
import com.flagship.wallet_ledger.ledger.event.LedgerTransactionCompletedEvent;
import com.flagship.wallet_ledger.ledger.exception.ErrorCode;
import com.flagship.wallet_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.ledger.exception.NotFoundException;
import com.flagship.wallet_ledger.ledger.exception.ValidationException;
import com.flagship.wallet_ledger.outbox.OutboxEvent;
import com.flagship.wallet_ledger.outbox.OutboxService;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Top-up, bonus and spend against a real database: the happy paths, replays,
 * and every way a transfer can be rejected without leaving a trace.
 */
class TransactionCoordinatorTest extends AbstractIntegrationTest {

    @Autowired
    private TransactionCoordinator coordinator;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private LedgerRepository ledgerRepository;

    @Autowired
    private WalletRegistry walletRegistry;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = createUser();
    }

    private TransferCommand command(UUID assetTypeId, String amount, String key) {
        return command(assetTypeId, amount, key, null);
    }

    private TransferCommand command(UUID assetTypeId, String amount, String key, String description) {
        return TransferCommand.builder()
            .userId(userId)
            .assetTypeId(assetTypeId)
            .amount(new BigDecimal(amount))
            .idempotencyKey(key)
            .description(description)
            .build();
    }

    private BigDecimal balance(UUID assetTypeId) {
        return queryService.getBalance(userId, assetTypeId).getBalance();
    }

    @Nested
    @DisplayName("Top-up")
    class TopUp {

        @Test
        @DisplayName("Top-up credits the user and a resubmission replays the same transaction")
        void topUpThenReplay() {
            printTestHeader("Top-up then replay");

            // Given: a top-up of 500 Gold Coins under one key
            String key = uniqueKey("k1");
            printInput("Key", key);

            // When: submitting it twice
            TransferResult first = coordinator.topUp(command(GOLD_COINS, "500", key));
            TransferResult second = coordinator.topUp(command(GOLD_COINS, "500", key));
            printOutput("First", first);
            printOutput("Second", second);

            // Then: one effect, two equal payloads
            assertFalse(first.isReplay());
            assertTrue(second.isReplay());
            assertEquals(first.getTransactionId(), second.getTransactionId());
            assertEquals(first.getAmount(), second.getAmount());
            assertEquals(TransactionType.TOPUP, second.getType());
            assertNull(first.getRemainingBalance(), "Only spends report a remaining balance");
            assertEquals(new BigDecimal("500.0000"), balance(GOLD_COINS));
            assertEquals(1, countEntriesWithKey(key));
            printSuccess("Replay returned the original transaction without a second effect");
        }

        @Test
        @DisplayName("Top-up debits the treasury wallet and seals the transaction as COMPLETED")
        void topUpDirectionAndStatus() {
            TransferResult result = coordinator.topUp(command(DIAMONDS, "25.5", uniqueKey("dir")));

            List<LedgerEntry> entries = ledgerRepository.findEntriesForTransaction(result.getTransactionId());
            assertEquals(1, entries.size());
            LedgerEntry entry = entries.get(0);

            Wallet userWallet = walletRegistry.find(userId, DIAMONDS).orElseThrow();
            Wallet treasuryWallet = walletRegistry.find(TREASURY, DIAMONDS).orElseThrow();

            assertEquals(treasuryWallet.getId(), entry.getDebitWalletId());
            assertEquals(userWallet.getId(), entry.getCreditWalletId());
            assertEquals(new BigDecimal("25.5000"), entry.getAmount());
            assertEquals("Top-up purchase", entry.getDescription());
            assertEquals(TransactionStatus.COMPLETED,
                ledgerRepository.findTransactionStatus(result.getTransactionId()).orElseThrow());
        }

        @Test
        @DisplayName("Default transaction description names the kind and amount")
        void defaultTransactionDescription() {
            TransferResult result = coordinator.topUp(command(GOLD_COINS, "100", uniqueKey("desc")));

            String description = jdbcTemplate.queryForObject(
                "SELECT description FROM transactions WHERE id = ?", String.class, result.getTransactionId());
            assertEquals("Top-up of 100.0000 credits", description);
        }

        @Test
        @DisplayName("Amounts are quantized to four fractional digits")
        void amountIsQuantized() {
            TransferResult result = coordinator.topUp(command(GOLD_COINS, "1.23456", uniqueKey("q")));

            assertEquals(new BigDecimal("1.2346"), result.getAmount());
            assertEquals(new BigDecimal("1.2346"), balance(GOLD_COINS));
        }

        @Test
        @DisplayName("First transfer creates the user's wallet")
        void firstTransferCreatesWallet() {
            assertEquals(0, countWallets(userId));

            coordinator.topUp(command(LOYALTY_POINTS, "10", uniqueKey("first")));

            assertEquals(1, countWallets(userId));
        }

        @Test
        @DisplayName("Committed transfer writes a LedgerTransactionCompleted outbox event")
        void writesOutboxEvent() {
            TransferResult result = coordinator.topUp(command(GOLD_COINS, "42", uniqueKey("outbox")));

            List<OutboxEvent> events = outboxService.getEventsForAggregate(
                LedgerTransactionCompletedEvent.AGGREGATE_TYPE, result.getTransactionId());
            assertEquals(1, events.size());
            assertEquals(LedgerTransactionCompletedEvent.EVENT_TYPE, events.get(0).getEventType());
            assertTrue(events.get(0).getPayload().contains(result.getTransactionId().toString()));
            assertFalse(events.get(0).isPublished());
        }
    }

    @Nested
    @DisplayName("Bonus")
    class Bonus {

        @Test
        @DisplayName("Bonus of 100 Loyalty Points is a treasury debit credited to the user")
        void bonusRecordsEntry() {
            printTestHeader("Bonus with description");

            // Given: a user with some Loyalty Points already
            coordinator.bonus(command(LOYALTY_POINTS, "7", uniqueKey("pre")));
            BigDecimal before = balance(LOYALTY_POINTS);

            // When: a referral bonus is issued
            TransferResult result = coordinator.bonus(command(LOYALTY_POINTS, "100", uniqueKey("bonus"), "referral"));
            printOutput("Result", result);

            // Then: the entry moves value from the treasury to the user
            LedgerEntry entry = ledgerRepository.findEntriesForTransaction(result.getTransactionId()).get(0);
            assertEquals(walletRegistry.find(TREASURY, LOYALTY_POINTS).orElseThrow().getId(), entry.getDebitWalletId());
            assertEquals(walletRegistry.find(userId, LOYALTY_POINTS).orElseThrow().getId(), entry.getCreditWalletId());
            assertEquals(TransactionType.BONUS, entry.getTransactionType());
            assertEquals("referral", entry.getDescription());
            assertEquals(before.add(new BigDecimal("100")), balance(LOYALTY_POINTS));
            printSuccess("Balance increased by exactly 100");
        }
    }

    @Nested
    @DisplayName("Spend")
    class Spend {

        @Test
        @DisplayName("Spend beyond the balance is rejected and leaves no trace")
        void insufficientFunds() {
            printTestHeader("Insufficient funds");

            // Given: a balance of 50
            coordinator.topUp(command(GOLD_COINS, "50", uniqueKey("seed")));
            String key = uniqueKey("big-spend");
            Integer transactionsBefore = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class);

            // When: spending 9999
            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> coordinator.spend(command(GOLD_COINS, "9999", key)));
            printOutput("Error", e.getMessage());

            // Then: nothing was written and the balance is unchanged
            assertEquals(ErrorCode.INSUFFICIENT_FUNDS, e.getErrorCode());
            assertEquals(new BigDecimal("50.0000"), e.getAvailable());
            assertEquals(new BigDecimal("9999.0000"), e.getRequested());
            assertEquals("Insufficient balance. Available: 50.0000, Required: 9999.0000", e.getMessage());
            assertEquals(new BigDecimal("50.0000"), balance(GOLD_COINS));
            assertEquals(0, countEntriesWithKey(key));
            assertEquals(transactionsBefore,
                jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
            printSuccess("Rejected with available and requested amounts");
        }

        @Test
        @DisplayName("Spend credits the treasury and reports the remaining balance, also on replay")
        void spendReportsRemainingBalance() {
            coordinator.topUp(command(DIAMONDS, "80", uniqueKey("seed")));
            String key = uniqueKey("spend");

            TransferResult first = coordinator.spend(command(DIAMONDS, "30", key));
            coordinator.topUp(command(DIAMONDS, "5", uniqueKey("later")));
            redisTemplate.delete(IdempotencyGuard.REDIS_KEY_PREFIX + key);
            TransferResult replay = coordinator.spend(command(DIAMONDS, "30", key));

            assertEquals(new BigDecimal("50.0000"), first.getRemainingBalance());
            assertTrue(replay.isReplay());
            assertEquals(first.getTransactionId(), replay.getTransactionId());
            assertEquals(new BigDecimal("50.0000"), replay.getRemainingBalance(),
                "Replay reports the balance right after the original spend");

            LedgerEntry entry = ledgerRepository.findEntriesForTransaction(first.getTransactionId()).get(0);
            assertEquals(walletRegistry.find(userId, DIAMONDS).orElseThrow().getId(), entry.getDebitWalletId());
            assertEquals(walletRegistry.find(TREASURY, DIAMONDS).orElseThrow().getId(), entry.getCreditWalletId());
            assertEquals("In-app purchase", entry.getDescription());
        }

        @Test
        @DisplayName("Spending the whole balance is allowed")
        void spendExactBalance() {
            coordinator.topUp(command(GOLD_COINS, "12.5", uniqueKey("seed")));

            TransferResult result = coordinator.spend(command(GOLD_COINS, "12.5", uniqueKey("all")));

            assertEquals(0, result.getRemainingBalance().signum());
            assertEquals(new BigDecimal("0.0000"), balance(GOLD_COINS));
        }

        @Test
        @DisplayName("Spend from a user that never held the asset fails with zero available")
        void spendWithoutWallet() {
            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> coordinator.spend(command(GOLD_COINS, "1", uniqueKey("none"))));

            assertEquals(0, e.getAvailable().signum());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Zero and negative amounts are rejected before touching the store")
        void nonPositiveAmount() {
            assertThrows(ValidationException.class, () -> coordinator.topUp(command(GOLD_COINS, "0", uniqueKey("z"))));
            assertThrows(ValidationException.class, () -> coordinator.topUp(command(GOLD_COINS, "-5", uniqueKey("n"))));
            assertThrows(ValidationException.class,
                () -> coordinator.topUp(command(GOLD_COINS, "0.00001", uniqueKey("tiny"))),
                "Rounds to zero at four digits");
            assertEquals(0, countWallets(userId));
        }

        @Test
        @DisplayName("Missing, blank and overlong idempotency keys are rejected")
        void malformedKeys() {
            assertThrows(ValidationException.class, () -> coordinator.topUp(command(GOLD_COINS, "1", null)));
            assertThrows(ValidationException.class, () -> coordinator.topUp(command(GOLD_COINS, "1", "  ")));
            assertThrows(ValidationException.class,
                () -> coordinator.topUp(command(GOLD_COINS, "1", "k".repeat(256))));

            String longest = "k".repeat(240) + UUID.randomUUID().toString().substring(0, 15);
            assertFalse(coordinator.topUp(command(GOLD_COINS, "1", longest)).isReplay());
        }

        @Test
        @DisplayName("Amounts beyond the column's range are rejected")
        void amountTooLarge() {
            assertThrows(ValidationException.class,
                () -> coordinator.topUp(command(GOLD_COINS, "12345678901234567", uniqueKey("huge"))));
        }

        @Test
        @DisplayName("Unknown asset type or user is NOT_FOUND")
        void unknownReferences() {
            NotFoundException asset = assertThrows(NotFoundException.class,
                () -> coordinator.topUp(command(UUID.randomUUID(), "1", uniqueKey("asset"))));
            assertEquals(ErrorCode.NOT_FOUND, asset.getErrorCode());

            TransferCommand unknownUser = TransferCommand.builder()
                .userId(UUID.randomUUID())
                .assetTypeId(GOLD_COINS)
                .amount(BigDecimal.ONE)
                .idempotencyKey(uniqueKey("user"))
                .build();
            assertThrows(NotFoundException.class, () -> coordinator.topUp(unknownUser));
        }

        @Test
        @DisplayName("Transfers on the treasury account itself are rejected")
        void treasuryCannotTransferToItself() {
            TransferCommand treasuryTopUp = TransferCommand.builder()
                .userId(TREASURY)
                .assetTypeId(GOLD_COINS)
                .amount(BigDecimal.TEN)
                .idempotencyKey(uniqueKey("self"))
                .build();

            ValidationException e = assertThrows(ValidationException.class, () -> coordinator.topUp(treasuryTopUp));
            assertEquals(0, countEntriesWithKey(treasuryTopUp.getIdempotencyKey()));
            assertFalse(e.getErrorCode().isRetryable());
        }

        @Test
        @DisplayName("A rejected key can be reused once the cause is fixed")
        void rejectedKeyIsNotConsumed() {
            String key = uniqueKey("retry");
            assertThrows(InsufficientFundsException.class, () -> coordinator.spend(command(GOLD_COINS, "5", key)));

            coordinator.topUp(command(GOLD_COINS, "5", uniqueKey("fund")));
            TransferResult result = coordinator.spend(command(GOLD_COINS, "5", key));

            assertFalse(result.isReplay());
            assertEquals(1, countEntriesWithKey(key));
        }
    }
}
