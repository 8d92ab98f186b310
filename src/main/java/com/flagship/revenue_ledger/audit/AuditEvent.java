package com.flagship.revenue_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One entry in the audit trail: who changed what, from what, to what, and why.
 *
 * {@code changes} holds before/after values keyed by field name; insertion order is kept.
 */
@Value
public class AuditEvent {
    UUID id;
    AuditEventType eventType;
    String entityType;
    String entityId;
    String actorId;
    Map<String, Object> changes;
    String reason;
    Instant createdAt;

    public static AuditEvent of(AuditEventType eventType, String entityType, String entityId,
                                String actorId, Map<String, Object> changes, String reason, Instant at) {
        return new AuditEvent(
            UUID.randomUUID(),
            eventType,
            entityType,
            entityId,
            actorId,
            Collections.unmodifiableMap(new LinkedHashMap<>(changes)),
            reason,
            at
        );
    }
}
