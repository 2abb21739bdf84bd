package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.AbstractIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ordered locking against real row locks: callers naming the same two wallets
 * in opposite orders must all finish.
 */
class LockCoordinatorConcurrencyTest extends AbstractIntegrationTest {

    @Autowired
    private LockCoordinator lockCoordinator;

    @Autowired
    private WalletRegistry walletRegistry;

    @Autowired
    @Qualifier("ledgerTransactionTemplate")
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("Lockers of {A, B} in both naming orders all complete")
    void bothOrderingsComplete() throws InterruptedException {
        printTestHeader("Deadlock freedom");

        // Given: two wallets of different users
        UUID walletA = transactionTemplate.execute(status -> walletRegistry.resolve(createUser(), GOLD_COINS)).getId();
        UUID walletB = transactionTemplate.execute(status -> walletRegistry.resolve(createUser(), GOLD_COINS)).getId();
        printInput("Wallet A", walletA);
        printInput("Wallet B", walletB);

        int threadCount = 16;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        // When: half name (A, B), half name (B, A), and each holds its locks briefly
        for (int i = 0; i < threadCount; i++) {
            List<UUID> requested = i % 2 == 0 ? List.of(walletA, walletB) : List.of(walletB, walletA);
            executor.submit(() -> {
                try {
                    startLatch.await();
                    transactionTemplate.executeWithoutResult(status -> {
                        lockCoordinator.lockInOrder(requested);
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        try {
                            Thread.sleep(10);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                    });
                    completed.incrementAndGet();
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "All lockers should finish");
        executor.shutdown();

        // Then: no deadlock was reported and the locks were exclusive
        printOutput("Completed", completed.get());
        assertTrue(failures.isEmpty(), "No locker should fail: " + failures);
        assertEquals(threadCount, completed.get());
        assertEquals(1, maxInside.get(), "Only one unit may hold both wallets at a time");
        printSuccess("All " + threadCount + " lockers completed");
    }

    @Test
    @DisplayName("lockInOrder refuses to run outside a unit of work")
    void requiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> lockCoordinator.lockInOrder(List.of(UUID.randomUUID())));
    }
}
