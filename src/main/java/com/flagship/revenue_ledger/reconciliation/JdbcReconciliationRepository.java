package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.money.Money;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcReconciliationRepository implements ReconciliationRepository {

    private static final String RECORD_COLUMNS =
        "id, reconciliation_date, revision, status, expected_balances, actual_balances, discrepancies, created_at";

    private static final String ALERT_COLUMNS =
        "id, reconciliation_id, reconciliation_date, account_key, expected_amount, actual_amount, " +
        "difference_amount, severity, status, resolved_by, resolved_at, resolution_notes, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final ReconciliationCodec codec;

    public JdbcReconciliationRepository(JdbcTemplate jdbcTemplate, ReconciliationCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public void saveRecord(ReconciliationRecord record) {
        jdbcTemplate.update(
            "INSERT INTO reconciliation_records (" + RECORD_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            record.getId(),
            Date.valueOf(record.getDate()),
            record.getRevision(),
            record.getStatus().name(),
            codec.encodeBalances(record.getExpectedBalances()),
            codec.encodeBalances(record.getActualBalances()),
            codec.encodeDiscrepancies(record.getDiscrepancies()),
            Timestamp.from(record.getCreatedAt())
        );
    }

    @Override
    public Optional<ReconciliationRecord> findLatest(LocalDate date) {
        return jdbcTemplate.query(
            "SELECT " + RECORD_COLUMNS + " FROM reconciliation_records " +
            "WHERE reconciliation_date = ? ORDER BY revision DESC LIMIT 1",
            recordRowMapper(),
            Date.valueOf(date)
        ).stream().findFirst();
    }

    @Override
    public Optional<ReconciliationRecord> findMostRecent() {
        return jdbcTemplate.query(
            "SELECT " + RECORD_COLUMNS + " FROM reconciliation_records " +
            "ORDER BY reconciliation_date DESC, revision DESC LIMIT 1",
            recordRowMapper()
        ).stream().findFirst();
    }

    @Override
    public List<ReconciliationRecord> findHistory(LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT " + RECORD_COLUMNS + " FROM reconciliation_records " +
            "WHERE reconciliation_date BETWEEN ? AND ? ORDER BY reconciliation_date, revision",
            recordRowMapper(),
            Date.valueOf(from),
            Date.valueOf(to)
        );
    }

    @Override
    public void saveAlert(DiscrepancyAlert alert) {
        jdbcTemplate.update(
            "INSERT INTO discrepancy_alerts (" + ALERT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            alert.getId(),
            alert.getReconciliationId(),
            Date.valueOf(alert.getReconciliationDate()),
            alert.getAccountKey(),
            alert.getExpectedAmount().toBigDecimal(),
            alert.getActualAmount().toBigDecimal(),
            alert.getDifferenceAmount().toBigDecimal(),
            alert.getSeverity().name(),
            alert.getStatus().name(),
            alert.getResolvedBy(),
            alert.getResolvedAt() != null ? Timestamp.from(alert.getResolvedAt()) : null,
            alert.getResolutionNotes(),
            Timestamp.from(alert.getCreatedAt())
        );
    }

    @Override
    public void updateAlert(DiscrepancyAlert alert) {
        // Only resolution metadata ever changes.
        int rows = jdbcTemplate.update(
            "UPDATE discrepancy_alerts SET status = ?, resolved_by = ?, resolved_at = ?, resolution_notes = ? " +
            "WHERE id = ? AND status = 'OPEN'",
            alert.getStatus().name(),
            alert.getResolvedBy(),
            alert.getResolvedAt() != null ? Timestamp.from(alert.getResolvedAt()) : null,
            alert.getResolutionNotes(),
            alert.getId()
        );
        if (rows != 1) {
            throw new IllegalStateException("Discrepancy alert " + alert.getId() + " is not open");
        }
    }

    @Override
    public Optional<DiscrepancyAlert> findAlert(UUID alertId) {
        return jdbcTemplate.query(
            "SELECT " + ALERT_COLUMNS + " FROM discrepancy_alerts WHERE id = ?",
            alertRowMapper(),
            alertId
        ).stream().findFirst();
    }

    @Override
    public List<DiscrepancyAlert> findOpenAlerts() {
        return jdbcTemplate.query(
            "SELECT " + ALERT_COLUMNS + " FROM discrepancy_alerts WHERE status = 'OPEN' " +
            "ORDER BY reconciliation_date, created_at",
            alertRowMapper()
        );
    }

    @Override
    public boolean hasOpenAlert(LocalDate reconciliationDate, String accountKey) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM discrepancy_alerts " +
            "WHERE reconciliation_date = ? AND account_key = ? AND status = 'OPEN'",
            Integer.class,
            Date.valueOf(reconciliationDate),
            accountKey
        );
        return count != null && count > 0;
    }

    @Override
    public List<DiscrepancyAlert> findAlertsForDates(LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
            "SELECT " + ALERT_COLUMNS + " FROM discrepancy_alerts " +
            "WHERE reconciliation_date BETWEEN ? AND ? ORDER BY reconciliation_date, created_at",
            alertRowMapper(),
            Date.valueOf(from),
            Date.valueOf(to)
        );
    }

    private RowMapper<ReconciliationRecord> recordRowMapper() {
        return (rs, rowNum) -> new ReconciliationRecord(
            UUID.fromString(rs.getString("id")),
            rs.getDate("reconciliation_date").toLocalDate(),
            rs.getInt("revision"),
            codec.decodeBalances(rs.getString("expected_balances")),
            codec.decodeBalances(rs.getString("actual_balances")),
            codec.decodeDiscrepancies(rs.getString("discrepancies")),
            ReconciliationStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<DiscrepancyAlert> alertRowMapper() {
        return (rs, rowNum) -> {
            Timestamp resolvedAt = rs.getTimestamp("resolved_at");
            return new DiscrepancyAlert(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("reconciliation_id")),
                rs.getDate("reconciliation_date").toLocalDate(),
                rs.getString("account_key"),
                Money.of(rs.getBigDecimal("expected_amount")),
                Money.of(rs.getBigDecimal("actual_amount")),
                Money.of(rs.getBigDecimal("difference_amount")),
                DiscrepancySeverity.valueOf(rs.getString("severity")),
                DiscrepancyStatus.valueOf(rs.getString("status")),
                rs.getString("resolved_by"),
                resolvedAt != null ? resolvedAt.toInstant() : null,
                rs.getString("resolution_notes"),
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
