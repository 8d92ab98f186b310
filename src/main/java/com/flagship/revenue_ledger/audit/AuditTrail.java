package com.flagship.revenue_ledger.audit;

import java.util.List;

/**
 * Durable sink for audit events.
 *
 * Balance corrections treat a failed write as fatal. Every other caller writes
 * audit events on a best-effort basis.
 */
public interface AuditTrail {

    void record(AuditEvent event);

    List<AuditEvent> findByEntity(String entityType, String entityId);
}
