package com.arbiter.lifecycle;

import com.arbiter.config.EngineProperties;
import com.arbiter.domain.enums.ExecutionReportType;
import com.arbiter.domain.enums.HaltCause;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.ExecutionReport;
import com.arbiter.domain.model.Position;
import com.arbiter.event.PositionEvent;
import com.arbiter.event.RiskEvent;
import com.arbiter.event.RiskEventType;
import com.arbiter.event.RiskLevel;
import com.arbiter.exception.IllegalTransitionException;
import com.arbiter.halt.HaltController;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * The only shared mutable state of the engine: one position per symbol plus the account snapshot.
 *
 * <p>Read once at cycle start through {@link #snapshot()}; changed only by confirmed execution
 * reports through {@link #onExecutionReport(ExecutionReport)}. Mandates and intents never touch
 * it, so capital in flight is never counted twice.
 *
 * <p>An illegal report does not corrupt the ledger: the position moves to FAILED, which
 * latches the halt and leaves only an exit admissible.
 *
 * <p>Thread-safety: all access is synchronized on the ledger. Reports arrive from the execution
 * adapter's threads, snapshots from the cycle engine.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final PositionStateMachine stateMachine;
    private final HaltController haltController;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final Map<String, Position> positions = new TreeMap<>();
    private AccountSnapshot account;

    public PositionLedger(
            PositionStateMachine stateMachine,
            HaltController haltController,
            ApplicationEventPublisher applicationEventPublisher,
            EngineProperties engineProperties) {
        this.stateMachine = stateMachine;
        this.haltController = haltController;
        this.applicationEventPublisher = applicationEventPublisher;
        this.account = AccountSnapshot.of(engineProperties.getInitialEquity());
    }

    // ---- Reads ----

    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(Collections.unmodifiableMap(new TreeMap<>(positions)), account);
    }

    public synchronized Position position(String symbol) {
        return positions.getOrDefault(symbol, Position.flat(symbol));
    }

    public synchronized AccountSnapshot account() {
        return account;
    }

    // ---- Confirmed execution results ----

    /**
     * Applies a confirmed execution report.
     *
     * @return the position after the report (FAILED if the report was illegal)
     */
    public synchronized Position onExecutionReport(ExecutionReport report) {
        Position current = position(report.getSymbol());

        TransitionResult result;
        try {
            result = stateMachine.apply(current, report);
        } catch (IllegalTransitionException e) {
            return markFailed(current, report, e);
        }

        Position next = result.getPosition();
        store(next);
        account = account.afterExecution(report.getRealizedPnl(), report.getFee());

        if (!result.getTransitions().isEmpty()) {
            log.info("{}: {} (size {}, equity {})",
                    report.getSymbol(), result.getTransitions(), next.getSize(), account.getEquity());
        } else {
            log.info("{}: {} in {} (size {}, equity {})",
                    report.getSymbol(), report.getType(), next.getState(), next.getSize(), account.getEquity());
        }
        applicationEventPublisher.publishEvent(new PositionEvent(this, next, result.getTransitions()));

        if (report.getType() == ExecutionReportType.EXECUTION_FAILED && next.getState() == PositionState.FAILED) {
            onFailed(next, RiskEventType.EXECUTION_FAILURE, "Execution failed: " + report.getDetail());
        }
        return next;
    }

    /**
     * Operator intervention for a FAILED position that holds nothing: walks it back to FLAT.
     * Positions with exposure leave FAILED only through an exit.
     */
    public synchronized Position resolveFailed(String symbol, String operator) {
        TransitionResult result = stateMachine.resolveFailed(position(symbol));
        store(result.getPosition());
        log.warn("{}: FAILED position without exposure resolved by {}: {}", symbol, operator, result.getTransitions());
        applicationEventPublisher.publishEvent(new PositionEvent(this, result.getPosition(), result.getTransitions()));
        return result.getPosition();
    }

    // ---- Internal ----

    private Position markFailed(Position current, ExecutionReport report, IllegalTransitionException e) {
        log.error("{}: illegal transition from {} on {}: {}",
                report.getSymbol(), current.getState(), report.getType(), e.getMessage());

        Position failed = current.toBuilder().state(PositionState.FAILED).build();
        store(failed);
        List<LifecycleTransition> transitions = current.getState() == PositionState.FAILED
                ? List.of()
                : List.of(new LifecycleTransition(
                        current.getSymbol(), current.getState(), PositionState.FAILED, report.getType()));
        applicationEventPublisher.publishEvent(new PositionEvent(this, failed, transitions));
        onFailed(failed, RiskEventType.ILLEGAL_TRANSITION, e.getMessage());
        return failed;
    }

    private void onFailed(Position failed, RiskEventType type, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("size", failed.getSize());
        details.put("direction", failed.getDirection().name());
        applicationEventPublisher.publishEvent(
                new RiskEvent(this, type, RiskLevel.CRITICAL, failed.getSymbol(), message, details));
        haltController.activate(HaltCause.FAILED_POSITION, failed.getSymbol(), message, -1L);
    }

    private void store(Position position) {
        positions.put(position.getSymbol(), position);
    }
}
