package com.arbiter.observability;

import com.arbiter.arbitration.DiscardedMandate;
import com.arbiter.event.ArbitrationAuditEvent;
import com.arbiter.event.RiskEvent;
import com.arbiter.event.RiskEventType;
import com.arbiter.halt.HaltController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics of the evaluation engine:
 * <ul>
 *   <li><b>arbiter.cycles</b> (counter): cycles completed</li>
 *   <li><b>arbiter.cycle.duration</b> (timer): wall time of a full cycle</li>
 *   <li><b>arbiter.intents</b> (counter, tag action): intents emitted</li>
 *   <li><b>arbiter.no_action</b> (counter): per-symbol decisions without an intent</li>
 *   <li><b>arbiter.discards</b> (counter, tag reason): discarded mandates</li>
 *   <li><b>arbiter.forced</b> (counter): forced mandates injected</li>
 *   <li><b>arbiter.integrity.failures</b> (counter): symbols failing integrity checks</li>
 *   <li><b>arbiter.halt.active</b> (gauge 0/1)</li>
 * </ul>
 *
 * <p>Counters are driven by audit and risk events; the gauge is polled from the halt controller.
 */
@Service
public class EngineMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter cycleCounter;
    private final Counter noActionCounter;
    private final Counter forcedCounter;
    private final Counter integrityFailureCounter;
    private final Timer cycleTimer;

    public EngineMetricsService(MeterRegistry meterRegistry, HaltController haltController) {
        this.meterRegistry = meterRegistry;

        this.cycleCounter = Counter.builder("arbiter.cycles")
                .description("Evaluation cycles completed")
                .register(meterRegistry);

        this.noActionCounter = Counter.builder("arbiter.no_action")
                .description("Per-symbol decisions that emitted no execution intent")
                .register(meterRegistry);

        this.forcedCounter = Counter.builder("arbiter.forced")
                .description("Forced REDUCE/EXIT mandates injected by the invariant evaluator")
                .register(meterRegistry);

        this.integrityFailureCounter = Counter.builder("arbiter.integrity.failures")
                .description("Symbol observations failing the integrity checks")
                .register(meterRegistry);

        this.cycleTimer = Timer.builder("arbiter.cycle.duration")
                .description("Wall time of a full evaluation cycle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);

        meterRegistry.gauge("arbiter.halt.active", haltController, halt -> halt.isActive() ? 1.0 : 0.0);
    }

    public void recordCycle(Duration elapsed) {
        cycleCounter.increment();
        cycleTimer.record(elapsed);
    }

    @EventListener
    @Order(20)
    public void onAudit(ArbitrationAuditEvent event) {
        AuditRecord auditRecord = event.getAuditRecord();
        if (auditRecord.getIntent() != null) {
            meterRegistry.counter("arbiter.intents", "action", auditRecord.getIntent().getAction().name())
                    .increment();
        } else {
            noActionCounter.increment();
        }
        for (DiscardedMandate discarded : auditRecord.getArbitration().getDiscarded()) {
            meterRegistry.counter("arbiter.discards", "reason", discarded.getReason().getCode()).increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.FORCED_MANDATE) {
            forcedCounter.increment();
        } else if (event.getEventType() == RiskEventType.INTEGRITY_FAILURE) {
            integrityFailureCounter.increment();
        }
    }
}
