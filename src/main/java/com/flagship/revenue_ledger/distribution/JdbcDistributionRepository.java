package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.exception.DuplicateDistributionException;
import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.money.Money;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * revenue_distributions is keyed by transaction id, so the primary key
 * rejects a second distribution of the same payment even when two requests
 * pass the fast-path check concurrently.
 */
@Repository
public class JdbcDistributionRepository implements DistributionRepository {

    private static final String COLUMNS =
        "transaction_id, payee_owner_id, payee_scope_id, gross_amount, service_charge, payee_amount, " +
        "rate, refunded_amount, refund_count, distributed_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcDistributionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void claim(DistributionRecord record) {
        try {
            jdbcTemplate.update(
                "INSERT INTO revenue_distributions (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                record.getTransactionId(),
                record.getPayeeAccount().getOwnerId(),
                record.getPayeeAccount().storageScope(),
                record.getGrossAmount().toBigDecimal(),
                record.getServiceCharge().toBigDecimal(),
                record.getPayeeAmount().toBigDecimal(),
                record.getRate(),
                record.getRefundedAmount().toBigDecimal(),
                record.getRefundCount(),
                Timestamp.from(record.getDistributedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateDistributionException(record.getTransactionId());
        }
    }

    @Override
    public Optional<DistributionRecord> find(String transactionId) {
        return queryOne("SELECT " + COLUMNS + " FROM revenue_distributions WHERE transaction_id = ?",
                transactionId);
    }

    @Override
    public Optional<DistributionRecord> findForUpdate(String transactionId) {
        return queryOne("SELECT " + COLUMNS + " FROM revenue_distributions WHERE transaction_id = ? FOR UPDATE",
                transactionId);
    }

    @Override
    public boolean exists(String transactionId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM revenue_distributions WHERE transaction_id = ?",
            Integer.class,
            transactionId
        );
        return count != null && count > 0;
    }

    @Override
    public void updateRefund(DistributionRecord record) {
        jdbcTemplate.update(
            "UPDATE revenue_distributions SET refunded_amount = ?, refund_count = ? WHERE transaction_id = ?",
            record.getRefundedAmount().toBigDecimal(),
            record.getRefundCount(),
            record.getTransactionId()
        );
    }

    private Optional<DistributionRecord> queryOne(String sql, String transactionId) {
        List<DistributionRecord> rows = jdbcTemplate.query(sql, rowMapper(), transactionId);
        return rows.stream().findFirst();
    }

    private RowMapper<DistributionRecord> rowMapper() {
        return (rs, rowNum) -> new DistributionRecord(
            rs.getString("transaction_id"),
            AccountRef.payee(rs.getString("payee_owner_id"), rs.getString("payee_scope_id")),
            Money.of(rs.getBigDecimal("gross_amount")),
            Money.of(rs.getBigDecimal("service_charge")),
            Money.of(rs.getBigDecimal("payee_amount")),
            rs.getBigDecimal("rate"),
            Money.of(rs.getBigDecimal("refunded_amount")),
            rs.getInt("refund_count"),
            rs.getTimestamp("distributed_at").toInstant()
        );
    }
}
