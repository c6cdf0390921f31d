package com.arbiter.halt;

import com.arbiter.domain.enums.HaltCause;
import com.arbiter.event.RiskEvent;
import com.arbiter.event.RiskEventType;
import com.arbiter.event.RiskLevel;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Latched emergency halt.
 *
 * <p>Once active, every non-EXIT mandate is suppressed and an EXIT is attempted for every
 * position that admits one. The halt persists until {@link #reset(String)} is called by an
 * operator: no auto-recovery, no timeout, no retry.
 *
 * <p>Causes:
 * <ul>
 *   <li>a position reached FAILED (illegal transition or execution failure)</li>
 *   <li>data-feed integrity loss (consecutive integrity failures on a symbol)</li>
 *   <li>total or correlation group exposure above its hard ceiling</li>
 *   <li>an operator request</li>
 * </ul>
 *
 * <p>Idempotent and thread-safe: the first activation wins via compareAndSet and later
 * activations are logged and ignored until reset.
 */
@Service
public class HaltController {

    private static final Logger log = LoggerFactory.getLogger(HaltController.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    private final AtomicReference<HaltRecord> active = new AtomicReference<>();

    public HaltController(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Activation ----

    /**
     * Latches the halt.
     *
     * @return true if this call activated the halt, false if it was already active
     */
    public boolean activate(HaltCause cause, String symbol, String detail, long cycleId) {
        HaltRecord record = HaltRecord.builder()
                .cause(cause)
                .symbol(symbol)
                .detail(detail)
                .cycleId(cycleId)
                .activatedAt(Instant.now())
                .build();

        if (!active.compareAndSet(null, record)) {
            log.warn("Halt already active ({}), ignoring {} on {}: {}", active.get().getCause(), cause, symbol, detail);
            return false;
        }

        log.error("HALT ACTIVATED: cause={} symbol={} cycle={} detail={}", cause, symbol, cycleId, detail);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cause", cause.name());
        details.put("cycleId", cycleId);
        details.put("detail", detail);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this, RiskEventType.HALT_TRIGGERED, RiskLevel.CRITICAL, symbol, "Halt activated: " + cause, details));
        return true;
    }

    /** Operator-requested halt. */
    public boolean activateByOperator(String operator, String reason) {
        return activate(HaltCause.OPERATOR, null, operator + ": " + reason, -1L);
    }

    // ---- Reset ----

    /**
     * Clears the halt. The only way out of halt mode.
     *
     * @param operator who reset the halt, recorded in the log and the event
     * @return the record that was cleared, empty if no halt was active
     */
    public Optional<HaltRecord> reset(String operator) {
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("Halt reset requires an operator");
        }
        HaltRecord cleared = active.getAndSet(null);
        if (cleared == null) {
            log.info("Halt reset requested by {} but no halt was active", operator);
            return Optional.empty();
        }

        log.warn("Halt reset by {} (was {} since {})", operator, cleared.getCause(), cleared.getActivatedAt());
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.HALT_RESET,
                RiskLevel.INFO,
                cleared.getSymbol(),
                "Halt reset by " + operator,
                Map.of("previousCause", cleared.getCause().name())));
        return Optional.of(cleared);
    }

    // ---- Queries ----

    public boolean isActive() {
        return active.get() != null;
    }

    public Optional<HaltRecord> current() {
        return Optional.ofNullable(active.get());
    }
}
