package com.arbiter.observability;

import com.arbiter.config.EngineProperties;
import com.arbiter.event.ArbitrationAuditEvent;
import com.arbiter.mapper.JsonHelper;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Audit trail of every per-symbol decision.
 *
 * <p>Each {@link AuditRecord} is:
 * <ul>
 *   <li>kept in an in-memory ring buffer (newest first) for fast queries</li>
 *   <li>published as an {@link ArbitrationAuditEvent} for metrics and durable shipping</li>
 *   <li>logged at DEBUG as canonical JSON</li>
 * </ul>
 *
 * <p>The ring buffer uses a {@link ConcurrentLinkedDeque} bounded by
 * {@code arbiter.engine.audit-buffer-size}; the oldest records are evicted first.
 */
@Service
public class ArbitrationAuditLog {

    private static final Logger log = LoggerFactory.getLogger(ArbitrationAuditLog.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final int bufferSize;

    private final ConcurrentLinkedDeque<AuditRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public ArbitrationAuditLog(ApplicationEventPublisher applicationEventPublisher, EngineProperties properties) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.bufferSize = properties.getAuditBufferSize();
    }

    // ---- Recording ----

    public void record(AuditRecord auditRecord) {
        ringBuffer.addFirst(auditRecord);
        while (ringBuffer.size() > bufferSize) {
            ringBuffer.removeLast();
        }

        if (log.isDebugEnabled()) {
            log.debug("audit {}", JsonHelper.toJson(auditRecord));
        }

        try {
            applicationEventPublisher.publishEvent(new ArbitrationAuditEvent(this, auditRecord));
        } catch (RuntimeException e) {
            // A failing listener must never break the cycle
            log.error("Failed to publish ArbitrationAuditEvent for {} cycle {}: {}",
                    auditRecord.getSymbol(), auditRecord.getCycleId(), e.getMessage());
        }
    }

    // ---- Ring buffer queries ----

    /** Most recent N records, newest first. */
    public List<AuditRecord> getRecent(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    /** Most recent N records of one symbol, newest first. */
    public List<AuditRecord> getRecent(int count, String symbol) {
        return ringBuffer.stream()
                .filter(r -> r.getSymbol().equals(symbol))
                .limit(count)
                .toList();
    }

    /** Records of one cycle, in symbol order. */
    public List<AuditRecord> getCycle(long cycleId) {
        return ringBuffer.stream()
                .filter(r -> r.getCycleId() == cycleId)
                .sorted(Comparator.comparing(AuditRecord::getSymbol))
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    /** Canonical JSON of a record; identical decisions render identical strings. */
    public String render(AuditRecord auditRecord) {
        return JsonHelper.toJson(auditRecord);
    }
}
