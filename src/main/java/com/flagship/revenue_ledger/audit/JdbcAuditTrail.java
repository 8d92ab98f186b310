package com.flagship.revenue_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail stored in the audit_events table; changes are kept as jsonb.
 */
@Repository
public class JdbcAuditTrail implements AuditTrail {

    private static final TypeReference<Map<String, Object>> CHANGES_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcAuditTrail(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(AuditEvent event) {
        jdbcTemplate.update(
            "INSERT INTO audit_events (id, event_type, entity_type, entity_id, actor_id, changes, reason, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?)",
            event.getId(),
            event.getEventType().name(),
            event.getEntityType(),
            event.getEntityId(),
            event.getActorId(),
            writeChanges(event.getChanges()),
            event.getReason(),
            Timestamp.from(event.getCreatedAt())
        );
    }

    @Override
    public List<AuditEvent> findByEntity(String entityType, String entityId) {
        return jdbcTemplate.query(
            "SELECT id, event_type, entity_type, entity_id, actor_id, changes, reason, created_at " +
            "FROM audit_events WHERE entity_type = ? AND entity_id = ? ORDER BY created_at",
            auditRowMapper(),
            entityType,
            entityId
        );
    }

    private String writeChanges(Map<String, Object> changes) {
        try {
            return objectMapper.writeValueAsString(changes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit changes", e);
        }
    }

    private Map<String, Object> readChanges(String json) {
        try {
            return objectMapper.readValue(json, CHANGES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt audit changes column: " + e.getMessage(), e);
        }
    }

    private RowMapper<AuditEvent> auditRowMapper() {
        return (rs, rowNum) -> new AuditEvent(
            UUID.fromString(rs.getString("id")),
            AuditEventType.valueOf(rs.getString("event_type")),
            rs.getString("entity_type"),
            rs.getString("entity_id"),
            rs.getString("actor_id"),
            readChanges(rs.getString("changes")),
            rs.getString("reason"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
