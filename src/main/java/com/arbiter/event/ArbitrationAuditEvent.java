package com.arbiter.event;

import com.arbiter.observability.AuditRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the {@code ArbitrationAuditLog} for every per-symbol decision.
 *
 * <p>Listeners use it for metrics and for shipping the audit trail to durable storage.
 */
public class ArbitrationAuditEvent extends ApplicationEvent {

    private final AuditRecord auditRecord;

    public ArbitrationAuditEvent(Object source, AuditRecord auditRecord) {
        super(source);
        this.auditRecord = auditRecord;
    }

    public AuditRecord getAuditRecord() {
        return auditRecord;
    }
}
