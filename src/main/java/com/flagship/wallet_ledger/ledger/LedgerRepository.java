package com.flagship.wallet_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.exception.ConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the transactions and ledger_entries tables.
 *
 * Writes require the caller's unit of work. ledger_entries is append-only:
 * this class never issues UPDATE or DELETE against it, and the schema
 * rejects them with a trigger.
 */
@Repository
@Slf4j
public class LedgerRepository {

    private static final String SELECT_ENTRY =
        "SELECT id, transaction_id, asset_type_id, debit_wallet_id, credit_wallet_id, amount, " +
        "transaction_type, description, idempotency_key, metadata, created_at, sequence_number " +
        "FROM ledger_entries ";

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final ObjectMapper objectMapper;

    public LedgerRepository(JdbcTemplate jdbcTemplate,
                            NamedParameterJdbcTemplate namedJdbcTemplate,
                            ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Inserts a PENDING transaction and returns its id.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID insertTransaction(TransactionType type, String description) {
        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO transactions (id, type, status, description, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            transactionId,
            type.name(),
            TransactionStatus.PENDING.name(),
            description
        );
        return transactionId;
    }

    /**
     * Appends one entry.
     *
     * @throws ConflictException if an entry with the same idempotency key exists;
     *         the enclosing unit of work is unusable afterwards and must roll back
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry appendEntry(UUID transactionId,
                                   UUID assetTypeId,
                                   UUID debitWalletId,
                                   UUID creditWalletId,
                                   BigDecimal amount,
                                   TransactionType type,
                                   String description,
                                   String idempotencyKey,
                                   Map<String, String> metadata) {
        UUID entryId = UUID.randomUUID();
        try {
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, transaction_id, asset_type_id, debit_wallet_id, credit_wallet_id, " +
                "amount, transaction_type, description, idempotency_key, metadata, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), CURRENT_TIMESTAMP)",
                entryId,
                transactionId,
                assetTypeId,
                debitWalletId,
                creditWalletId,
                amount,
                type.name(),
                description,
                idempotencyKey,
                writeMetadata(metadata)
            );
        } catch (DuplicateKeyException e) {
            log.info("Idempotency key already committed by a concurrent request: {}", idempotencyKey);
            throw new ConflictException(idempotencyKey, e);
        }

        return jdbcTemplate.queryForObject(SELECT_ENTRY + "WHERE id = ?", entryRowMapper(), entryId);
    }

    /**
     * Seals a PENDING transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void markCompleted(UUID transactionId) {
        int updated = jdbcTemplate.update(
            "UPDATE transactions SET status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ? AND status = ?",
            TransactionStatus.COMPLETED.name(),
            transactionId,
            TransactionStatus.PENDING.name()
        );
        if (updated != 1) {
            throw new IllegalStateException("Transaction " + transactionId + " is not PENDING");
        }
    }

    public Optional<LedgerEntry> findEntryByIdempotencyKey(String idempotencyKey) {
        List<LedgerEntry> entries = jdbcTemplate.query(
            SELECT_ENTRY + "WHERE idempotency_key = ?",
            entryRowMapper(),
            idempotencyKey
        );
        return entries.stream().findFirst();
    }

    public List<LedgerEntry> findEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE transaction_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            transactionId
        );
    }

    public Optional<TransactionStatus> findTransactionStatus(UUID transactionId) {
        List<String> statuses = jdbcTemplate.queryForList(
            "SELECT status FROM transactions WHERE id = ?",
            String.class,
            transactionId
        );
        return statuses.stream().findFirst().map(TransactionStatus::valueOf);
    }

    /**
     * Newest entries touching any of the wallets, joined with their transaction status.
     */
    public List<HistoryItem> findHistory(Collection<UUID> walletIds, int limit) {
        if (walletIds.isEmpty()) {
            return List.of();
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("walletIds", walletIds)
            .addValue("limit", limit);

        return namedJdbcTemplate.query(
            "SELECT e.id, e.transaction_id, e.asset_type_id, e.transaction_type, t.status, e.amount, " +
            "       e.description, e.created_at, e.debit_wallet_id, e.credit_wallet_id " +
            "FROM ledger_entries e " +
            "JOIN transactions t ON t.id = e.transaction_id " +
            "WHERE e.debit_wallet_id IN (:walletIds) OR e.credit_wallet_id IN (:walletIds) " +
            "ORDER BY e.created_at DESC, e.sequence_number DESC " +
            "LIMIT :limit",
            params,
            (rs, rowNum) -> new HistoryItem(
                rs.getObject("id", UUID.class),
                rs.getObject("transaction_id", UUID.class),
                rs.getObject("asset_type_id", UUID.class),
                TransactionType.valueOf(rs.getString("transaction_type")),
                TransactionStatus.valueOf(rs.getString("status")),
                rs.getBigDecimal("amount"),
                rs.getString("description"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getObject("debit_wallet_id", UUID.class),
                rs.getObject("credit_wallet_id", UUID.class)
            )
        );
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("transaction_id", UUID.class),
            rs.getObject("asset_type_id", UUID.class),
            rs.getObject("debit_wallet_id", UUID.class),
            rs.getObject("credit_wallet_id", UUID.class),
            rs.getBigDecimal("amount"),
            TransactionType.valueOf(rs.getString("transaction_type")),
            rs.getString("description"),
            rs.getString("idempotency_key"),
            readMetadata(rs),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }

    private String writeMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize entry metadata", e);
        }
    }

    private Map<String, String> readMetadata(ResultSet rs) throws SQLException {
        String json = rs.getString("metadata");
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt metadata on ledger entry " + rs.getObject("id"), e);
        }
    }
}
