package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.AbstractIntegrationTest;
import com.flagship.wallet_ledger.ledger.exception.InsufficientFundsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent transfers: balance-gated spends, idempotency races and the
 * ledger-wide invariants they must preserve.
 */
class ConcurrentTransferTest extends AbstractIntegrationTest {

    @Autowired
    private TransactionCoordinator coordinator;

    @Autowired
    private LedgerQueryService queryService;

    private TransferCommand command(UUID userId, UUID assetTypeId, String amount, String key) {
        return TransferCommand.builder()
            .userId(userId)
            .assetTypeId(assetTypeId)
            .amount(new BigDecimal(amount))
            .idempotencyKey(key)
            .build();
    }

    @Test
    @DisplayName("10 concurrent spends of 10 against a balance of 50: exactly 5 succeed")
    void concurrentSpendsNeverOverdraw() throws InterruptedException {
        printTestHeader("Concurrent spends");

        // Given: a user with 50 Gold Coins
        UUID userId = createUser();
        coordinator.topUp(command(userId, GOLD_COINS, "50", uniqueKey("seed")));

        int threadCount = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger insufficient = new AtomicInteger();
        List<Throwable> unexpected = new CopyOnWriteArrayList<>();
        List<BigDecimal> remainingBalances = new CopyOnWriteArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        // When: 10 spends of 10 with distinct keys start together
        for (int i = 0; i < threadCount; i++) {
            String key = uniqueKey("spend-" + i);
            executor.submit(() -> {
                try {
                    startLatch.await();
                    TransferResult result = coordinator.spend(command(userId, GOLD_COINS, "10", key));
                    remainingBalances.add(result.getRemainingBalance());
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    insufficient.incrementAndGet();
                } catch (Throwable t) {
                    unexpected.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "All spends should finish");
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Insufficient funds", insufficient.get());

        // Then: exactly the funded half went through
        assertTrue(unexpected.isEmpty(), "Unexpected failures: " + unexpected);
        assertEquals(5, succeeded.get());
        assertEquals(5, insufficient.get());
        assertEquals(new BigDecimal("0.0000"), queryService.getBalance(userId, GOLD_COINS).getBalance());
        assertTrue(remainingBalances.stream().allMatch(b -> b.signum() >= 0));
        assertEquals(5, Set.copyOf(remainingBalances).size(), "Each success saw a distinct balance");
        printSuccess("Balance ended at 0 and never went negative");
    }

    @Test
    @DisplayName("Concurrent requests sharing one key commit exactly one entry")
    void sameKeyRace() throws InterruptedException {
        printTestHeader("Idempotency race");

        UUID userId = createUser();
        String key = uniqueKey("race");
        int threadCount = 8;

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        List<TransferResult> results = new CopyOnWriteArrayList<>();
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    results.add(coordinator.topUp(command(userId, DIAMONDS, "75", key)));
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Results", results.size());
        printOutput("Failures", failures);

        assertTrue(failures.isEmpty(), "Losers should be turned into replays: " + failures);
        assertEquals(threadCount, results.size());
        assertEquals(1, results.stream().filter(r -> !r.isReplay()).count(), "Exactly one original");
        assertEquals(1, results.stream().map(TransferResult::getTransactionId).distinct().count(),
            "Every caller sees the same transaction");
        assertEquals(1, countEntriesWithKey(key));
        assertEquals(new BigDecimal("75.0000"), queryService.getBalance(userId, DIAMONDS).getBalance());
        printSuccess("One entry, " + threadCount + " identical payloads");
    }

    @Test
    @DisplayName("Same-key spends that only one balance covers all return the one committed spend")
    void sameKeySpendRace() throws InterruptedException {
        printTestHeader("Same-key spend race");

        // Given: exactly enough for one spend
        UUID userId = createUser();
        coordinator.topUp(command(userId, GOLD_COINS, "10", uniqueKey("seed")));
        String key = uniqueKey("spend-race");
        int threadCount = 6;

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        List<TransferResult> results = new CopyOnWriteArrayList<>();
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    results.add(coordinator.spend(command(userId, GOLD_COINS, "10", key)));
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Results", results.size());
        printOutput("Failures", failures);

        // Then: no caller sees InsufficientFunds; all see the same spend
        assertTrue(failures.isEmpty(), "Every same-key spend should replay the winner: " + failures);
        assertEquals(threadCount, results.size());
        assertEquals(1, results.stream().filter(r -> !r.isReplay()).count(), "Exactly one original");
        assertEquals(1, results.stream().map(TransferResult::getTransactionId).distinct().count());
        assertTrue(results.stream().allMatch(r -> r.getRemainingBalance().signum() == 0),
            "Replays report the winner's remaining balance");
        assertEquals(1, countEntriesWithKey(key));
        assertEquals(new BigDecimal("0.0000"), queryService.getBalance(userId, GOLD_COINS).getBalance());
        printSuccess("One spend committed, " + (threadCount - 1) + " replays");
    }

    @Test
    @DisplayName("Mixed concurrent traffic keeps every asset zero-sum and every user non-negative")
    void ledgerInvariantsHoldUnderLoad() throws InterruptedException {
        List<UUID> users = List.of(createUser(), createUser(), createUser());
        List<UUID> assets = List.of(GOLD_COINS, DIAMONDS, LOYALTY_POINTS);
        for (UUID user : users) {
            for (UUID asset : assets) {
                coordinator.topUp(command(user, asset, "20", uniqueKey("seed")));
            }
        }

        int operations = 60;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(operations);
        Map<String, Throwable> unexpected = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(12);

        for (int i = 0; i < operations; i++) {
            UUID user = users.get(i % users.size());
            UUID asset = assets.get((i / users.size()) % assets.size());
            TransactionType type = TransactionType.values()[i % 3];
            String amount = type == TransactionType.SPEND ? "7" : "3";
            String key = uniqueKey("load-" + i);
            executor.submit(() -> {
                try {
                    startLatch.await();
                    coordinator.execute(type, command(user, asset, amount, key));
                } catch (InsufficientFundsException e) {
                    // expected once a wallet runs dry
                } catch (Throwable t) {
                    unexpected.put(key, t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(unexpected.isEmpty(), "Unexpected failures: " + unexpected);

        // Zero-sum: the wallets of each asset net to nothing (the treasury carries the negative side)
        List<Map<String, Object>> netByAsset = jdbcTemplate.queryForList(
            "SELECT w.asset_type_id, " +
            "       SUM(COALESCE((SELECT SUM(amount) FROM ledger_entries c WHERE c.credit_wallet_id = w.id), 0) - " +
            "           COALESCE((SELECT SUM(amount) FROM ledger_entries d WHERE d.debit_wallet_id = w.id), 0)) AS net " +
            "FROM wallets w GROUP BY w.asset_type_id");
        for (Map<String, Object> row : netByAsset) {
            assertEquals(0, ((BigDecimal) row.get("net")).signum(), "Asset " + row.get("asset_type_id") + " is not zero-sum");
        }

        // Non-negativity for every user wallet
        for (UUID user : users) {
            for (UUID asset : assets) {
                assertTrue(queryService.getBalance(user, asset).getBalance().signum() >= 0);
            }
        }
        Integer negativeUserWallets = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM wallets w JOIN users u ON u.id = w.user_id " +
            "WHERE NOT u.is_system AND " +
            "      COALESCE((SELECT SUM(amount) FROM ledger_entries c WHERE c.credit_wallet_id = w.id), 0) < " +
            "      COALESCE((SELECT SUM(amount) FROM ledger_entries d WHERE d.debit_wallet_id = w.id), 0)",
            Integer.class);
        assertEquals(0, negativeUserWallets);
    }
}
