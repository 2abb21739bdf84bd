package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.exception.NotFoundException;
import com.flagship.wallet_ledger.reference.UserAccountEntity;
import com.flagship.wallet_ledger.reference.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the wallet a user holds for an asset type, creating it on first use.
 *
 * Creation relies on the (user_id, asset_type_id) unique constraint: the insert
 * is {@code ON CONFLICT DO NOTHING}, so when two units create the same wallet
 * concurrently the slower one waits for the faster one, inserts nothing, and
 * re-reads the committed row instead of failing.
 */
@Component
@Slf4j
public class WalletRegistry {

    private static final String SELECT_WALLET =
        "SELECT id, user_id, asset_type_id, created_at FROM wallets ";

    private final JdbcTemplate jdbcTemplate;
    private final UserAccountRepository userAccountRepository;

    public WalletRegistry(JdbcTemplate jdbcTemplate, UserAccountRepository userAccountRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.userAccountRepository = userAccountRepository;
    }

    /**
     * Returns the user's wallet for the asset, creating it if needed.
     * Must run inside the caller's unit of work so the new row commits or
     * rolls back with the transfer that needed it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet resolve(UUID userId, UUID assetTypeId) {
        Optional<Wallet> existing = find(userId, assetTypeId);
        if (existing.isPresent()) {
            return existing.get();
        }

        int inserted = jdbcTemplate.update(
            "INSERT INTO wallets (id, user_id, asset_type_id, created_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (user_id, asset_type_id) DO NOTHING",
            UUID.randomUUID(),
            userId,
            assetTypeId
        );
        if (inserted == 0) {
            log.debug("Wallet for user {} and asset {} was created concurrently, re-reading", userId, assetTypeId);
        }

        return find(userId, assetTypeId)
            .orElseThrow(() -> new IllegalStateException(
                String.format("Wallet for user %s and asset %s missing after insert", userId, assetTypeId)));
    }

    /**
     * Returns the treasury's wallet for the asset, creating it if needed.
     *
     * @throws NotFoundException if the deployment has no treasury user
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet resolveTreasury(UUID assetTypeId) {
        UserAccountEntity treasury = userAccountRepository.findFirstBySystemTrue()
            .orElseThrow(() -> new NotFoundException("Treasury account not configured"));
        return resolve(treasury.getId(), assetTypeId);
    }

    /**
     * Looks a wallet up without ever creating one.
     */
    public Optional<Wallet> find(UUID userId, UUID assetTypeId) {
        List<Wallet> wallets = jdbcTemplate.query(
            SELECT_WALLET + "WHERE user_id = ? AND asset_type_id = ?",
            walletRowMapper(),
            userId,
            assetTypeId
        );
        return wallets.stream().findFirst();
    }

    /**
     * All wallets of a user, or only the one for {@code assetTypeId} when given.
     */
    public List<Wallet> findByUser(UUID userId, UUID assetTypeId) {
        if (assetTypeId == null) {
            return jdbcTemplate.query(
                SELECT_WALLET + "WHERE user_id = ? ORDER BY created_at",
                walletRowMapper(),
                userId
            );
        }
        return find(userId, assetTypeId).map(List::of).orElse(List.of());
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getObject("asset_type_id", UUID.class),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
