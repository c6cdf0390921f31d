package com.arbiter.lifecycle;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.ExecutionReportType;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.model.ExecutionReport;
import com.arbiter.domain.model.Position;
import com.arbiter.exception.IllegalTransitionException;
import com.arbiter.risk.RiskCalculator;
import com.arbiter.risk.StopRules;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * The position lifecycle: legal transitions, admissible mandates per state, and the
 * application of confirmed execution reports.
 *
 * <p>Legal transitions:
 * <pre>
 *   FLAT     → ENTERING, FAILED
 *   ENTERING → OPEN, CLOSED (aborted, nothing filled), FAILED
 *   OPEN     → REDUCING, CLOSING, FAILED
 *   REDUCING → OPEN, CLOSING, FAILED
 *   CLOSING  → CLOSED, FAILED
 *   CLOSED   → FLAT
 *   FAILED   → CLOSING
 * </pre>
 *
 * <p>Anything else is rejected with {@link IllegalTransitionException}; there is no silent
 * correction. Stateless: the current position is always passed in.
 */
@Component
public class PositionStateMachine {

    private static final Map<PositionState, Set<PositionState>> LEGAL = new EnumMap<>(PositionState.class);

    static {
        LEGAL.put(PositionState.FLAT, EnumSet.of(PositionState.ENTERING, PositionState.FAILED));
        LEGAL.put(PositionState.ENTERING,
                EnumSet.of(PositionState.OPEN, PositionState.CLOSED, PositionState.FAILED));
        LEGAL.put(PositionState.OPEN,
                EnumSet.of(PositionState.REDUCING, PositionState.CLOSING, PositionState.FAILED));
        LEGAL.put(PositionState.REDUCING,
                EnumSet.of(PositionState.OPEN, PositionState.CLOSING, PositionState.FAILED));
        LEGAL.put(PositionState.CLOSING, EnumSet.of(PositionState.CLOSED, PositionState.FAILED));
        LEGAL.put(PositionState.CLOSED, EnumSet.of(PositionState.FLAT));
        LEGAL.put(PositionState.FAILED, EnumSet.of(PositionState.CLOSING));
    }

    public boolean isLegal(PositionState from, PositionState to) {
        return LEGAL.get(from).contains(to);
    }

    public Set<PositionState> legalTargets(PositionState from) {
        return Collections.unmodifiableSet(LEGAL.get(from));
    }

    /** Mandate types the lifecycle admits in {@code state}. */
    public Set<MandateType> admissibleMandates(PositionState state) {
        return switch (state) {
            case FLAT -> EnumSet.of(MandateType.ENTER, MandateType.HOLD);
            case ENTERING -> EnumSet.of(MandateType.EXIT);
            case OPEN -> EnumSet.of(
                    MandateType.ADD, MandateType.REDUCE, MandateType.EXIT, MandateType.HOLD, MandateType.BLOCK);
            case REDUCING -> EnumSet.of(MandateType.REDUCE, MandateType.EXIT);
            case CLOSING, CLOSED -> EnumSet.noneOf(MandateType.class);
            case FAILED -> EnumSet.of(MandateType.EXIT);
        };
    }

    public boolean isAdmissible(PositionState state, MandateType type) {
        return admissibleMandates(state).contains(type);
    }

    // ---- Execution reports ----

    /**
     * Applies a confirmed execution report to the position.
     *
     * @throws IllegalTransitionException when the report implies a transition outside the
     *         legal table, or when the mandate behind it is not admissible in the current state
     */
    public TransitionResult apply(Position position, ExecutionReport report) {
        if (!position.getSymbol().equals(report.getSymbol())) {
            throw illegal(position, report, "Report for " + report.getSymbol() + " applied to " + position.getSymbol());
        }
        checkOriginatingMandate(position, report);

        Transitions transitions = new Transitions(position.getSymbol(), report.getType());
        Position next = switch (report.getType()) {
            case ENTRY_ACKNOWLEDGED -> acknowledgeEntry(position, report, transitions);
            case ENTRY_FILLED -> fillEntry(position, report, transitions);
            case ENTRY_ABORTED -> abortEntry(position, report, transitions);
            case ADD_FILLED -> fillAdd(position, report);
            case REDUCE_ACKNOWLEDGED -> acknowledgeReduce(position, report, transitions);
            case REDUCE_FILLED -> fillReduce(position, report, transitions);
            case EXIT_ACKNOWLEDGED -> transitions.move(position, PositionState.CLOSING, this, report);
            case EXIT_FILLED -> fillExit(position, report, transitions);
            case EXECUTION_FAILED -> fail(position, report, transitions);
        };
        return new TransitionResult(next, transitions.taken());
    }

    /**
     * Reports that start an execution must come from a mandate the current state admits.
     * Fills and aborts complete an execution that was admitted when it started.
     */
    private void checkOriginatingMandate(Position position, ExecutionReport report) {
        MandateType required = switch (report.getType()) {
            case ENTRY_ACKNOWLEDGED -> MandateType.ENTER;
            case ADD_FILLED -> MandateType.ADD;
            case REDUCE_ACKNOWLEDGED -> MandateType.REDUCE;
            case EXIT_ACKNOWLEDGED -> MandateType.EXIT;
            default -> null;
        };
        if (required == null) {
            return;
        }
        if (report.getMandateType() != required) {
            throw illegal(position, report, report.getType() + " must originate from " + required
                    + ", was " + report.getMandateType());
        }
        if (!isAdmissible(position.getState(), required)) {
            throw illegal(position, report, required + " is not admissible in " + position.getState());
        }
    }

    private Position acknowledgeEntry(Position position, ExecutionReport report, Transitions transitions) {
        requireDirection(position, report, report.getDirection());
        requirePositive(position, report, report.getQuantity(), "quantity");
        Position entering = position.toBuilder()
                .direction(report.getDirection())
                .size(report.getQuantity())
                .entryPrice(report.getPrice())
                .stopPrice(report.getStopPrice())
                .liquidationPrice(null)
                .riskReserved(BigDecimal.ZERO)
                .build();
        return transitions.move(entering, PositionState.ENTERING, this, report);
    }

    private Position fillEntry(Position position, ExecutionReport report, Transitions transitions) {
        requirePositive(position, report, report.getQuantity(), "quantity");
        requirePositive(position, report, report.getPrice(), "price");
        if (report.getDirection() != null && report.getDirection() != position.getDirection()) {
            throw illegal(position, report, "Entry filled " + report.getDirection()
                    + " on a " + position.getDirection() + " entry");
        }
        BigDecimal stop = StopRules.tighter(position.getDirection(), position.getStopPrice(), report.getStopPrice());
        Position open = position.toBuilder()
                .size(report.getQuantity())
                .entryPrice(report.getPrice())
                .stopPrice(stop)
                .liquidationPrice(report.getLiquidationPrice())
                .build();
        open = open.toBuilder().riskReserved(open.riskAtStop()).build();
        return transitions.move(open, PositionState.OPEN, this, report);
    }

    private Position abortEntry(Position position, ExecutionReport report, Transitions transitions) {
        transitions.move(position, PositionState.CLOSED, this, report);
        return transitions.move(Position.flat(position.getSymbol()), PositionState.FLAT, this, report);
    }

    private Position fillAdd(Position position, ExecutionReport report) {
        if (report.getDirection() != null && report.getDirection() != position.getDirection()) {
            throw illegal(position, report, "ADD " + report.getDirection() + " on a "
                    + position.getDirection() + " position; direction is fixed while not FLAT");
        }
        requirePositive(position, report, report.getQuantity(), "quantity");
        requirePositive(position, report, report.getPrice(), "price");

        BigDecimal size = position.getSize().add(report.getQuantity());
        BigDecimal entry = position.getEntryPrice() == null
                ? report.getPrice()
                : position.getEntryPrice().multiply(position.getSize())
                        .add(report.getPrice().multiply(report.getQuantity()))
                        .divide(size, RiskCalculator.MC);
        Position added = position.toBuilder()
                .size(size)
                .entryPrice(entry)
                .stopPrice(StopRules.tighter(position.getDirection(), position.getStopPrice(), report.getStopPrice()))
                .liquidationPrice(report.getLiquidationPrice())
                .build();
        return added.toBuilder().riskReserved(added.riskAtStop()).build();
    }

    private Position acknowledgeReduce(Position position, ExecutionReport report, Transitions transitions) {
        // A further reduce while one is working keeps the position in REDUCING
        if (position.getState() == PositionState.REDUCING) {
            return position;
        }
        return transitions.move(position, PositionState.REDUCING, this, report);
    }

    private Position fillReduce(Position position, ExecutionReport report, Transitions transitions) {
        if (position.getState() != PositionState.REDUCING) {
            throw illegal(position, report, "REDUCE_FILLED outside REDUCING");
        }
        requirePositive(position, report, report.getQuantity(), "quantity");
        if (report.getQuantity().compareTo(position.getSize()) > 0) {
            throw illegal(position, report, "Reduce fill " + report.getQuantity()
                    + " exceeds position size " + position.getSize());
        }
        BigDecimal remaining = position.getSize().subtract(report.getQuantity());
        if (remaining.signum() == 0) {
            Position closing = transitions.move(
                    position.toBuilder().size(BigDecimal.ZERO).build(), PositionState.CLOSING, this, report);
            transitions.move(closing, PositionState.CLOSED, this, report);
            return transitions.move(Position.flat(position.getSymbol()), PositionState.FLAT, this, report);
        }
        Position reduced = position.toBuilder()
                .size(remaining)
                .stopPrice(StopRules.tighter(position.getDirection(), position.getStopPrice(), report.getStopPrice()))
                .liquidationPrice(report.getLiquidationPrice())
                .build();
        reduced = reduced.toBuilder().riskReserved(reduced.riskAtStop()).build();
        return transitions.move(reduced, PositionState.OPEN, this, report);
    }

    private Position fillExit(Position position, ExecutionReport report, Transitions transitions) {
        if (position.getState() != PositionState.CLOSING) {
            throw illegal(position, report, "EXIT_FILLED outside CLOSING");
        }
        BigDecimal filled = report.getQuantity() != null ? report.getQuantity() : position.getSize();
        if (filled.signum() < 0 || filled.compareTo(position.getSize()) > 0) {
            throw illegal(position, report, "Exit fill " + filled + " outside [0, " + position.getSize() + "]");
        }
        BigDecimal remaining = position.getSize().subtract(filled);
        if (remaining.signum() > 0) {
            // Partial exit fill: still CLOSING
            return position.toBuilder().size(remaining).build();
        }
        transitions.move(position.toBuilder().size(BigDecimal.ZERO).build(), PositionState.CLOSED, this, report);
        return transitions.move(Position.flat(position.getSymbol()), PositionState.FLAT, this, report);
    }

    private Position fail(Position position, ExecutionReport report, Transitions transitions) {
        if (position.getState() == PositionState.FAILED) {
            return position;
        }
        return transitions.move(position, PositionState.FAILED, this, report);
    }

    /**
     * Walks a FAILED position without exposure back to FLAT (FAILED → CLOSING → CLOSED → FLAT).
     * There is nothing to exit, so no execution report will ever arrive for it.
     */
    public TransitionResult resolveFailed(Position position) {
        if (position.getState() != PositionState.FAILED || position.hasExposure()) {
            throw new IllegalTransitionException(position.getSymbol(), position.getState(), null,
                    "Only a FAILED position without exposure can be resolved, was " + position.getState()
                            + " size " + position.getSize());
        }
        Transitions transitions = new Transitions(position.getSymbol(), null);
        Position closing = transitions.move(position, PositionState.CLOSING, this, null);
        transitions.move(closing, PositionState.CLOSED, this, null);
        Position flat = transitions.move(Position.flat(position.getSymbol()), PositionState.FLAT, this, null);
        return new TransitionResult(flat, transitions.taken());
    }

    // ---- Helpers ----

    private void requireDirection(Position position, ExecutionReport report, Direction direction) {
        if (direction == null || !direction.isDirectional()) {
            throw illegal(position, report, report.getType() + " requires LONG or SHORT");
        }
    }

    private void requirePositive(Position position, ExecutionReport report, BigDecimal value, String field) {
        if (value == null || value.signum() <= 0) {
            throw illegal(position, report, report.getType() + " requires a positive " + field + ", was " + value);
        }
    }

    private static IllegalTransitionException illegal(Position position, ExecutionReport report, String message) {
        return new IllegalTransitionException(
                position.getSymbol(), position.getState(), report != null ? report.getType() : null, message);
    }

    /** Accumulates the edges taken while applying one report, checking each against the table. */
    private static final class Transitions {

        private final String symbol;
        private final ExecutionReportType cause;
        private final List<LifecycleTransition> taken = new ArrayList<>();

        private Transitions(String symbol, ExecutionReportType cause) {
            this.symbol = symbol;
            this.cause = cause;
        }

        private Position move(
                Position position, PositionState to, PositionStateMachine machine, ExecutionReport report) {
            PositionState from = taken.isEmpty() ? position.getState() : taken.get(taken.size() - 1).getTo();
            if (!machine.isLegal(from, to)) {
                throw illegal(position.toBuilder().state(from).build(), report,
                        "Illegal transition " + from + " -> " + to);
            }
            taken.add(new LifecycleTransition(symbol, from, to, cause));
            return position.toBuilder().state(to).build();
        }

        private List<LifecycleTransition> taken() {
            return List.copyOf(taken);
        }
    }
}
