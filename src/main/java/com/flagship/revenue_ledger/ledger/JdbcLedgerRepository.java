package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.IntegrityException;
import com.flagship.revenue_ledger.money.Money;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of the ledger storage port.
 *
 * Uses JdbcTemplate directly rather than JPA so that locking and the
 * database-enforced invariants stay visible:
 * - balance rows are created with INSERT ... ON CONFLICT DO NOTHING and then
 *   locked with SELECT ... FOR UPDATE, which serializes postings per account
 * - a CHECK constraint rejects any balance row that violates the invariant
 * - a trigger rejects UPDATE and DELETE on ledger_entries
 */
@Repository
public class JdbcLedgerRepository implements LedgerRepository {

    private static final String BALANCE_COLUMNS =
        "id, owner_id, owner_type, scope_id, current_balance, total_credits, total_debits, " +
        "pending_amount, last_transaction_at, version, created_at";

    private static final String ENTRY_SELECT =
        "SELECT e.id, e.balance_id, e.external_transaction_ref, e.entry_type, e.amount, " +
        "e.balance_before, e.balance_after, e.actor_id, e.description, e.created_at, e.sequence_number, " +
        "b.owner_id, b.owner_type, b.scope_id " +
        "FROM ledger_entries e JOIN account_balances b ON b.id = e.balance_id ";

    private static final String ACCOUNT_FILTER = "b.owner_id = ? AND b.owner_type = ? AND b.scope_id = ? ";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public AccountBalance lockOrCreate(AccountRef account, Instant now) {
        jdbcTemplate.update(
            "INSERT INTO account_balances (id, owner_id, owner_type, scope_id, created_at) " +
            "VALUES (?, ?, ?, ?, ?) ON CONFLICT (owner_id, owner_type, scope_id) DO NOTHING",
            UUID.randomUUID(),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope(),
            Timestamp.from(now)
        );

        return jdbcTemplate.queryForObject(
            "SELECT " + BALANCE_COLUMNS + " FROM account_balances " +
            "WHERE owner_id = ? AND owner_type = ? AND scope_id = ? FOR UPDATE",
            balanceRowMapper(),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope()
        );
    }

    @Override
    public Optional<AccountBalance> lockExisting(AccountRef account) {
        List<AccountBalance> rows = jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM account_balances " +
            "WHERE owner_id = ? AND owner_type = ? AND scope_id = ? FOR UPDATE",
            balanceRowMapper(),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope()
        );
        return rows.stream().findFirst();
    }

    @Override
    public boolean updateBalance(AccountBalance updated, long expectedVersion) {
        try {
            int rows = jdbcTemplate.update(
                "UPDATE account_balances SET current_balance = ?, total_credits = ?, total_debits = ?, " +
                "pending_amount = ?, last_transaction_at = ?, version = ? " +
                "WHERE id = ? AND version = ?",
                updated.getCurrentBalance().toBigDecimal(),
                updated.getTotalCredits().toBigDecimal(),
                updated.getTotalDebits().toBigDecimal(),
                updated.getPendingAmount().toBigDecimal(),
                timestamp(updated.getLastTransactionAt()),
                updated.getVersion(),
                updated.getId(),
                expectedVersion
            );
            return rows == 1;
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityException(
                "Database rejected balance update for " + updated.getAccount().key(), e);
        }
    }

    @Override
    public LedgerEntry appendEntry(LedgerEntry entry) {
        Long sequence = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_entries (id, balance_id, external_transaction_ref, entry_type, amount, " +
            "balance_before, balance_after, actor_id, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            entry.getId(),
            entry.getBalanceId(),
            entry.getExternalTransactionRef(),
            entry.getEntryType().name(),
            entry.getAmount().toBigDecimal(),
            entry.getBalanceBefore().toBigDecimal(),
            entry.getBalanceAfter().toBigDecimal(),
            entry.getActorId(),
            entry.getDescription(),
            Timestamp.from(entry.getCreatedAt())
        );
        if (sequence == null) {
            throw new IntegrityException("No sequence number assigned to ledger entry " + entry.getId());
        }
        return entry.withSequenceNumber(sequence);
    }

    @Override
    public Optional<AccountBalance> findBalance(AccountRef account) {
        List<AccountBalance> rows = jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM account_balances " +
            "WHERE owner_id = ? AND owner_type = ? AND scope_id = ?",
            balanceRowMapper(),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope()
        );
        return rows.stream().findFirst();
    }

    @Override
    public List<AccountBalance> findAllBalances() {
        return jdbcTemplate.query(
            "SELECT " + BALANCE_COLUMNS + " FROM account_balances ORDER BY owner_type, owner_id, scope_id",
            balanceRowMapper()
        );
    }

    @Override
    public List<LedgerEntry> findEntries(AccountRef account, Instant from, Instant to) {
        return jdbcTemplate.query(
            ENTRY_SELECT + "WHERE " + ACCOUNT_FILTER +
            "AND e.created_at >= ? AND e.created_at < ? ORDER BY e.sequence_number",
            entryRowMapper(),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope(),
            Timestamp.from(from),
            Timestamp.from(to)
        );
    }

    @Override
    public List<LedgerEntry> findEntriesBetween(Instant from, Instant to) {
        return jdbcTemplate.query(
            ENTRY_SELECT + "WHERE e.created_at >= ? AND e.created_at < ? ORDER BY e.sequence_number",
            entryRowMapper(),
            Timestamp.from(from),
            Timestamp.from(to)
        );
    }

    @Override
    public Optional<LedgerEntry> findLastEntryBefore(AccountRef account, Instant before) {
        List<LedgerEntry> rows = jdbcTemplate.query(
            ENTRY_SELECT + "WHERE " + ACCOUNT_FILTER +
            "AND e.created_at < ? ORDER BY e.sequence_number DESC LIMIT 1",
            entryRowMapper(),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope(),
            Timestamp.from(before)
        );
        return rows.stream().findFirst();
    }

    @Override
    public Money netChangeSince(AccountRef account, Instant since) {
        BigDecimal net = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN e.entry_type IN ('CREDIT', 'CREDIT_ADJUSTMENT') " +
            "THEN e.amount ELSE -e.amount END), 0) " +
            "FROM ledger_entries e JOIN account_balances b ON b.id = e.balance_id " +
            "WHERE " + ACCOUNT_FILTER + "AND e.created_at >= ?",
            BigDecimal.class,
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope(),
            Timestamp.from(since)
        );
        return net != null ? Money.of(net) : Money.ZERO;
    }

    @Override
    public Optional<Money> balanceAt(AccountRef account, Instant at) {
        // single statement: balance row and later entries come from the same snapshot
        List<BigDecimal> rows = jdbcTemplate.query(
            "SELECT b.current_balance - COALESCE((" +
            "  SELECT SUM(CASE WHEN e.entry_type IN ('CREDIT', 'CREDIT_ADJUSTMENT') THEN e.amount ELSE -e.amount END) " +
            "  FROM ledger_entries e WHERE e.balance_id = b.id AND e.created_at >= ?), 0) AS balance_at " +
            "FROM account_balances b WHERE " + ACCOUNT_FILTER,
            (rs, rowNum) -> rs.getBigDecimal("balance_at"),
            Timestamp.from(at),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope()
        );
        return rows.stream().findFirst().map(Money::of);
    }

    private RowMapper<AccountBalance> balanceRowMapper() {
        return (rs, rowNum) -> new AccountBalance(
            UUID.fromString(rs.getString("id")),
            accountRef(rs),
            Money.of(rs.getBigDecimal("current_balance")),
            Money.of(rs.getBigDecimal("total_credits")),
            Money.of(rs.getBigDecimal("total_debits")),
            Money.of(rs.getBigDecimal("pending_amount")),
            instant(rs.getTimestamp("last_transaction_at")),
            rs.getLong("version"),
            instant(rs.getTimestamp("created_at"))
        );
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("balance_id")),
            accountRef(rs),
            rs.getString("external_transaction_ref"),
            EntryType.valueOf(rs.getString("entry_type")),
            Money.of(rs.getBigDecimal("amount")),
            Money.of(rs.getBigDecimal("balance_before")),
            Money.of(rs.getBigDecimal("balance_after")),
            rs.getString("actor_id"),
            rs.getString("description"),
            instant(rs.getTimestamp("created_at")),
            rs.getLong("sequence_number")
        );
    }

    private static AccountRef accountRef(ResultSet rs) throws SQLException {
        return AccountRef.of(
            rs.getString("owner_id"),
            OwnerType.valueOf(rs.getString("owner_type")),
            rs.getString("scope_id")
        );
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
