package com.flagship.revenue_ledger.correction;

import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.ledger.OwnerType;
import com.flagship.revenue_ledger.money.Money;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcCorrectionRepository implements CorrectionRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCorrectionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(BalanceCorrection correction) {
        jdbcTemplate.update(
            "INSERT INTO balance_corrections (id, balance_id, ledger_entry_id, original_balance, " +
            "corrected_balance, difference_amount, reason, evidence, admin_actor_id, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            correction.getId(),
            correction.getBalanceId(),
            correction.getLedgerEntryId(),
            correction.getOriginalBalance().toBigDecimal(),
            correction.getCorrectedBalance().toBigDecimal(),
            correction.getDifference().toBigDecimal(),
            correction.getReason(),
            correction.getEvidence(),
            correction.getAdminActorId(),
            Timestamp.from(correction.getCreatedAt())
        );
    }

    @Override
    public List<BalanceCorrection> findByAccount(AccountRef account) {
        return jdbcTemplate.query(
            "SELECT c.id, c.balance_id, c.ledger_entry_id, c.original_balance, c.corrected_balance, " +
            "c.difference_amount, c.reason, c.evidence, c.admin_actor_id, c.created_at, " +
            "b.owner_id, b.owner_type, b.scope_id " +
            "FROM balance_corrections c JOIN account_balances b ON b.id = c.balance_id " +
            "WHERE b.owner_id = ? AND b.owner_type = ? AND b.scope_id = ? ORDER BY c.created_at",
            correctionRowMapper(),
            account.getOwnerId(),
            account.getOwnerType().name(),
            account.storageScope()
        );
    }

    private RowMapper<BalanceCorrection> correctionRowMapper() {
        return (rs, rowNum) -> new BalanceCorrection(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("balance_id")),
            AccountRef.of(rs.getString("owner_id"), OwnerType.valueOf(rs.getString("owner_type")),
                    rs.getString("scope_id")),
            Money.of(rs.getBigDecimal("original_balance")),
            Money.of(rs.getBigDecimal("corrected_balance")),
            Money.of(rs.getBigDecimal("difference_amount")),
            rs.getString("reason"),
            rs.getString("evidence"),
            rs.getString("admin_actor_id"),
            UUID.fromString(rs.getString("ledger_entry_id")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
