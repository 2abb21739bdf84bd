package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Takes exclusive row locks on wallets in one global order.
 *
 * Every unit that needs several wallets locks them in ascending order of their
 * identifier's canonical string form, whichever wallet it "started" from. Two
 * units contending for the same wallets therefore queue on the first one
 * instead of each holding what the other wants.
 *
 * Locks are {@code SELECT ... FOR UPDATE} row locks owned by the enclosing
 * unit of work and released by its commit or rollback.
 */
@Component
@Slf4j
public class LockCoordinator {

    static final Comparator<UUID> LOCK_ORDER = Comparator.comparing(UUID::toString);

    private final JdbcTemplate jdbcTemplate;

    public LockCoordinator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Locks each distinct wallet, one at a time, in lock order.
     * Blocks while another unit holds any of them.
     *
     * @return the wallet ids in the order they were locked
     * @throws NotFoundException if a wallet does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<UUID> lockInOrder(Collection<UUID> walletIds) {
        List<UUID> ordered = lockOrder(walletIds);

        for (UUID walletId : ordered) {
            List<UUID> locked = jdbcTemplate.queryForList(
                "SELECT id FROM wallets WHERE id = ? FOR UPDATE",
                UUID.class,
                walletId
            );
            if (locked.isEmpty()) {
                throw new NotFoundException("Wallet not found: " + walletId);
            }
        }

        log.debug("Locked wallets {}", ordered);
        return ordered;
    }

    /**
     * The distinct ids in the order {@link #lockInOrder} acquires them.
     */
    public static List<UUID> lockOrder(Collection<UUID> walletIds) {
        return walletIds.stream()
            .filter(Objects::nonNull)
            .distinct()
            .sorted(LOCK_ORDER)
            .toList();
    }
}
