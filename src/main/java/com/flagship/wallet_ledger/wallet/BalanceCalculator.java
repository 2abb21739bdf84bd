package com.flagship.wallet_ledger.wallet;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Derives balances from ledger history.
 *
 * balance = sum(amount where the wallet is credited) - sum(amount where it is debited)
 *
 * Nothing is cached: every call folds the entries visible to the current unit
 * of work. A SPEND must call this only after the wallet's lock is held.
 */
@Component
public class BalanceCalculator {

    /** Fractional digits of every persisted amount. */
    public static final int SCALE = 4;

    /** Integer digits allowed by NUMERIC(20, 4). */
    public static final int MAX_INTEGER_DIGITS = 16;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private final JdbcTemplate jdbcTemplate;

    public BalanceCalculator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Current balance of a wallet. A wallet with no entries, or an id that
     * does not exist, has balance zero.
     */
    @Transactional(readOnly = true)
    public BigDecimal balanceOf(UUID walletId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN credit_wallet_id = ? THEN amount ELSE 0 END), 0) - " +
            "       COALESCE(SUM(CASE WHEN debit_wallet_id = ? THEN amount ELSE 0 END), 0) " +
            "FROM ledger_entries " +
            "WHERE credit_wallet_id = ? OR debit_wallet_id = ?",
            BigDecimal.class,
            walletId,
            walletId,
            walletId,
            walletId
        );

        return balance != null ? balance.setScale(SCALE, RoundingMode.UNNECESSARY) : ZERO;
    }

    /**
     * Scales an amount to the ledger's fixed 4 fractional digits.
     */
    public static BigDecimal quantize(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
