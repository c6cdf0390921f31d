package com.arbiter.unit.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.ExecutionReportType;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.model.ExecutionReport;
import com.arbiter.domain.model.Position;
import com.arbiter.exception.IllegalTransitionException;
import com.arbiter.lifecycle.LifecycleTransition;
import com.arbiter.lifecycle.PositionStateMachine;
import com.arbiter.lifecycle.TransitionResult;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PositionStateMachine: the legal transition table, mandate admissibility per state
 * and the application of confirmed execution reports.
 */
class PositionStateMachineTest {

    private static final String SYMBOL = "BTCUSDT";

    private PositionStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        stateMachine = new PositionStateMachine();
    }

    // ==============================
    // TRANSITION TABLE
    // ==============================

    @Nested
    @DisplayName("Transition Table")
    class TransitionTable {

        private final Map<PositionState, Set<PositionState>> expected = Map.of(
                PositionState.FLAT, EnumSet.of(PositionState.ENTERING, PositionState.FAILED),
                PositionState.ENTERING, EnumSet.of(PositionState.OPEN, PositionState.CLOSED, PositionState.FAILED),
                PositionState.OPEN, EnumSet.of(PositionState.REDUCING, PositionState.CLOSING, PositionState.FAILED),
                PositionState.REDUCING, EnumSet.of(PositionState.OPEN, PositionState.CLOSING, PositionState.FAILED),
                PositionState.CLOSING, EnumSet.of(PositionState.CLOSED, PositionState.FAILED),
                PositionState.CLOSED, EnumSet.of(PositionState.FLAT),
                PositionState.FAILED, EnumSet.of(PositionState.CLOSING));

        @Test
        @DisplayName("Every (from, to) pair is legal exactly when the table lists it")
        void everyPair_matchesTable() {
            for (PositionState from : PositionState.values()) {
                for (PositionState to : PositionState.values()) {
                    assertThat(stateMachine.isLegal(from, to))
                            .as("%s -> %s", from, to)
                            .isEqualTo(expected.get(from).contains(to));
                }
            }
        }

        @Test
        @DisplayName("CLOSED cannot fail; every other state can")
        void failedReachableFromAllButClosed() {
            for (PositionState from : PositionState.values()) {
                boolean canFail = stateMachine.isLegal(from, PositionState.FAILED);
                assertThat(canFail).as(from.name())
                        .isEqualTo(from != PositionState.CLOSED && from != PositionState.FAILED);
            }
        }

        @Test
        @DisplayName("Random report sequences only ever take edges of the table, and cover all of them")
        void randomReportSequences_stayInTable() {
            Random random = new Random(20240614L);
            Set<String> covered = new HashSet<>();

            for (int run = 0; run < 500; run++) {
                Position position = Position.flat(SYMBOL);
                for (int step = 0; step < 30; step++) {
                    ExecutionReport report = randomReport(random, position);
                    TransitionResult result;
                    try {
                        result = stateMachine.apply(position, report);
                    } catch (IllegalTransitionException e) {
                        // A rejected report fails the position, as the ledger does
                        result = stateMachine.apply(position, report(ExecutionReportType.EXECUTION_FAILED).build());
                    }

                    PositionState from = position.getState();
                    for (LifecycleTransition transition : result.getTransitions()) {
                        assertThat(transition.getFrom()).as("run %d step %d", run, step).isEqualTo(from);
                        assertThat(expected.get(transition.getFrom()))
                                .as("run %d step %d: %s", run, step, transition)
                                .contains(transition.getTo());
                        covered.add(transition.getFrom() + "->" + transition.getTo());
                        from = transition.getTo();
                    }
                    assertThat(result.getPosition().getState()).isEqualTo(from);
                    assertThat(result.getPosition().getState()).isNotEqualTo(PositionState.CLOSED);
                    position = result.getPosition();
                }
            }

            int legalEdges = expected.values().stream().mapToInt(Set::size).sum();
            assertThat(covered).hasSize(legalEdges);
        }

        @Test
        @DisplayName("No state transitions to itself")
        void noSelfLoops() {
            for (PositionState state : PositionState.values()) {
                assertThat(stateMachine.isLegal(state, state)).as(state.name()).isFalse();
            }
        }
    }

    // ==============================
    // MANDATE ADMISSIBILITY
    // ==============================

    @Nested
    @DisplayName("Mandate Admissibility")
    class Admissibility {

        @Test
        @DisplayName("FLAT admits only ENTER and HOLD")
        void flat() {
            assertThat(stateMachine.admissibleMandates(PositionState.FLAT))
                    .containsExactlyInAnyOrder(MandateType.ENTER, MandateType.HOLD);
        }

        @Test
        @DisplayName("OPEN admits everything except ENTER")
        void open() {
            assertThat(stateMachine.admissibleMandates(PositionState.OPEN))
                    .containsExactlyInAnyOrder(
                            MandateType.ADD, MandateType.REDUCE, MandateType.EXIT, MandateType.HOLD, MandateType.BLOCK);
        }

        @Test
        @DisplayName("REDUCING admits only REDUCE and EXIT")
        void reducing() {
            assertThat(stateMachine.admissibleMandates(PositionState.REDUCING))
                    .containsExactlyInAnyOrder(MandateType.REDUCE, MandateType.EXIT);
        }

        @Test
        @DisplayName("ENTERING and FAILED admit only EXIT")
        void enteringAndFailed() {
            assertThat(stateMachine.admissibleMandates(PositionState.ENTERING)).containsExactly(MandateType.EXIT);
            assertThat(stateMachine.admissibleMandates(PositionState.FAILED)).containsExactly(MandateType.EXIT);
        }

        @Test
        @DisplayName("CLOSING and CLOSED admit nothing")
        void closingAndClosed() {
            assertThat(stateMachine.admissibleMandates(PositionState.CLOSING)).isEmpty();
            assertThat(stateMachine.admissibleMandates(PositionState.CLOSED)).isEmpty();
        }

        @Test
        @DisplayName("Risk-increasing mandates are never admissible outside FLAT and OPEN")
        void riskIncreasingOnlyInFlatOrOpen() {
            for (PositionState state : PositionState.values()) {
                boolean anyIncrease = stateMachine.admissibleMandates(state).stream()
                        .anyMatch(MandateType::isRiskIncreasing);
                assertThat(anyIncrease).as(state.name())
                        .isEqualTo(state == PositionState.FLAT || state == PositionState.OPEN);
            }
        }
    }

    // ==============================
    // ENTRY
    // ==============================

    @Nested
    @DisplayName("Entry Reports")
    class Entry {

        @Test
        @DisplayName("ENTRY_ACKNOWLEDGED moves FLAT to ENTERING with the requested size")
        void acknowledge_flatToEntering() {
            TransitionResult result = stateMachine.apply(Position.flat(SYMBOL), entryAck("10", "100", "95"));

            Position position = result.getPosition();
            assertThat(position.getState()).isEqualTo(PositionState.ENTERING);
            assertThat(position.getDirection()).isEqualTo(Direction.LONG);
            assertThat(position.getSize()).isEqualByComparingTo("10");
            assertThat(result.getTransitions())
                    .extracting(LifecycleTransition::getFrom, LifecycleTransition::getTo)
                    .containsExactly(tuple(PositionState.FLAT, PositionState.ENTERING));
        }

        @Test
        @DisplayName("ENTRY_FILLED moves ENTERING to OPEN and reserves the loss at stop")
        void fill_enteringToOpen() {
            Position entering = stateMachine.apply(Position.flat(SYMBOL), entryAck("10", "100", "95")).getPosition();

            Position open = stateMachine.apply(entering, report(ExecutionReportType.ENTRY_FILLED)
                    .quantity(new BigDecimal("10"))
                    .price(new BigDecimal("101"))
                    .build()).getPosition();

            assertThat(open.getState()).isEqualTo(PositionState.OPEN);
            assertThat(open.getEntryPrice()).isEqualByComparingTo("101");
            assertThat(open.getRiskReserved()).isEqualByComparingTo("60");
        }

        @Test
        @DisplayName("ENTRY_ABORTED walks ENTERING through CLOSED back to FLAT")
        void abort_enteringToFlat() {
            Position entering = stateMachine.apply(Position.flat(SYMBOL), entryAck("10", "100", "95")).getPosition();

            TransitionResult result = stateMachine.apply(entering, report(ExecutionReportType.ENTRY_ABORTED).build());

            assertThat(result.getPosition().getState()).isEqualTo(PositionState.FLAT);
            assertThat(result.getPosition().getSize()).isEqualByComparingTo("0");
            assertThat(result.getTransitions()).extracting(LifecycleTransition::getTo)
                    .containsExactly(PositionState.CLOSED, PositionState.FLAT);
        }

        @Test
        @DisplayName("ENTRY_ACKNOWLEDGED must originate from an ENTER mandate")
        void acknowledge_wrongMandate_rejected() {
            ExecutionReport report = report(ExecutionReportType.ENTRY_ACKNOWLEDGED)
                    .mandateType(MandateType.ADD)
                    .direction(Direction.LONG)
                    .quantity(BigDecimal.ONE)
                    .build();

            assertThatThrownBy(() -> stateMachine.apply(Position.flat(SYMBOL), report))
                    .isInstanceOf(IllegalTransitionException.class)
                    .hasMessageContaining("must originate from ENTER");
        }

        @Test
        @DisplayName("ENTRY_ACKNOWLEDGED on an OPEN position is rejected: ENTER is not admissible")
        void acknowledge_onOpen_rejected() {
            assertThatThrownBy(() -> stateMachine.apply(open("10"), entryAck("1", "100", "95")))
                    .isInstanceOf(IllegalTransitionException.class)
                    .hasMessageContaining("not admissible in OPEN");
        }

        @Test
        @DisplayName("ENTRY_FILLED on a FLAT position is an illegal transition")
        void fill_onFlat_rejected() {
            ExecutionReport fill = report(ExecutionReportType.ENTRY_FILLED)
                    .quantity(BigDecimal.ONE)
                    .price(new BigDecimal("100"))
                    .build();

            assertThatThrownBy(() -> stateMachine.apply(Position.flat(SYMBOL), fill))
                    .isInstanceOf(IllegalTransitionException.class)
                    .satisfies(e -> assertThat(((IllegalTransitionException) e).getFrom()).isEqualTo(PositionState.FLAT));
        }
    }

    // ==============================
    // ADD / REDUCE
    // ==============================

    @Nested
    @DisplayName("Add and Reduce Reports")
    class AddReduce {

        @Test
        @DisplayName("ADD_FILLED keeps OPEN, averages the entry and only tightens the stop")
        void add_averagesEntry() {
            ExecutionReport add = report(ExecutionReportType.ADD_FILLED)
                    .mandateType(MandateType.ADD)
                    .quantity(new BigDecimal("10"))
                    .price(new BigDecimal("110"))
                    .stopPrice(new BigDecimal("80"))
                    .build();

            TransitionResult result = stateMachine.apply(open("10"), add);

            Position position = result.getPosition();
            assertThat(position.getState()).isEqualTo(PositionState.OPEN);
            assertThat(position.getSize()).isEqualByComparingTo("20");
            assertThat(position.getEntryPrice()).isEqualByComparingTo("105");
            assertThat(position.getStopPrice()).isEqualByComparingTo("90");
            assertThat(result.getTransitions()).isEmpty();
        }

        @Test
        @DisplayName("ADD_FILLED in the opposite direction is rejected")
        void add_oppositeDirection_rejected() {
            ExecutionReport add = report(ExecutionReportType.ADD_FILLED)
                    .mandateType(MandateType.ADD)
                    .direction(Direction.SHORT)
                    .quantity(BigDecimal.ONE)
                    .price(new BigDecimal("100"))
                    .build();

            assertThatThrownBy(() -> stateMachine.apply(open("10"), add))
                    .isInstanceOf(IllegalTransitionException.class)
                    .hasMessageContaining("direction is fixed");
        }

        @Test
        @DisplayName("Partial reduce goes OPEN -> REDUCING -> OPEN with the smaller size")
        void reduce_partial_returnsToOpen() {
            Position reducing = stateMachine.apply(open("10"), reduceAck()).getPosition();
            assertThat(reducing.getState()).isEqualTo(PositionState.REDUCING);

            Position reduced = stateMachine.apply(reducing, report(ExecutionReportType.REDUCE_FILLED)
                    .quantity(new BigDecimal("3"))
                    .build()).getPosition();

            assertThat(reduced.getState()).isEqualTo(PositionState.OPEN);
            assertThat(reduced.getSize()).isEqualByComparingTo("7");
            assertThat(reduced.getRiskReserved()).isEqualByComparingTo("70");
        }

        @Test
        @DisplayName("A reduce that fills the whole size closes the position")
        void reduce_full_closesPosition() {
            Position reducing = stateMachine.apply(open("10"), reduceAck()).getPosition();

            TransitionResult result = stateMachine.apply(reducing, report(ExecutionReportType.REDUCE_FILLED)
                    .quantity(new BigDecimal("10"))
                    .build());

            assertThat(result.getPosition().getState()).isEqualTo(PositionState.FLAT);
            assertThat(result.getTransitions()).extracting(LifecycleTransition::getTo)
                    .containsExactly(PositionState.CLOSING, PositionState.CLOSED, PositionState.FLAT);
        }

        @Test
        @DisplayName("REDUCE_ACKNOWLEDGED while already REDUCING stays in REDUCING")
        void reduceAck_inReducing_staysInState() {
            Position reducing = stateMachine.apply(open("10"), reduceAck()).getPosition();

            TransitionResult result = stateMachine.apply(reducing, reduceAck());

            assertThat(result.getPosition().getState()).isEqualTo(PositionState.REDUCING);
            assertThat(result.getTransitions()).isEmpty();
        }

        @Test
        @DisplayName("REDUCE_FILLED on an OPEN position is rejected")
        void reduceFill_outsideReducing_rejected() {
            ExecutionReport fill = report(ExecutionReportType.REDUCE_FILLED).quantity(BigDecimal.ONE).build();

            assertThatThrownBy(() -> stateMachine.apply(open("10"), fill))
                    .isInstanceOf(IllegalTransitionException.class);
        }

        @Test
        @DisplayName("A reduce fill larger than the position is rejected")
        void reduceFill_oversized_rejected() {
            Position reducing = stateMachine.apply(open("10"), reduceAck()).getPosition();
            ExecutionReport fill = report(ExecutionReportType.REDUCE_FILLED).quantity(new BigDecimal("11")).build();

            assertThatThrownBy(() -> stateMachine.apply(reducing, fill))
                    .isInstanceOf(IllegalTransitionException.class)
                    .hasMessageContaining("exceeds position size");
        }
    }

    // ==============================
    // EXIT / FAILURE
    // ==============================

    @Nested
    @DisplayName("Exit and Failure Reports")
    class ExitFailure {

        @Test
        @DisplayName("Exit goes OPEN -> CLOSING -> CLOSED -> FLAT")
        void exit_fullPath() {
            Position closing = stateMachine.apply(open("10"), exitAck()).getPosition();
            assertThat(closing.getState()).isEqualTo(PositionState.CLOSING);

            TransitionResult result = stateMachine.apply(closing, report(ExecutionReportType.EXIT_FILLED).build());

            assertThat(result.getPosition().getState()).isEqualTo(PositionState.FLAT);
            assertThat(result.getPosition().getDirection()).isEqualTo(Direction.NONE);
            assertThat(result.getTransitions()).extracting(LifecycleTransition::getTo)
                    .containsExactly(PositionState.CLOSED, PositionState.FLAT);
        }

        @Test
        @DisplayName("A partial exit fill keeps the position CLOSING with the remainder")
        void exit_partialFill_staysClosing() {
            Position closing = stateMachine.apply(open("10"), exitAck()).getPosition();

            Position partial = stateMachine.apply(closing, report(ExecutionReportType.EXIT_FILLED)
                    .quantity(new BigDecimal("4"))
                    .build()).getPosition();

            assertThat(partial.getState()).isEqualTo(PositionState.CLOSING);
            assertThat(partial.getSize()).isEqualByComparingTo("6");
        }

        @Test
        @DisplayName("Exit acknowledged while ENTERING is illegal: ENTERING never goes to CLOSING")
        void exitAck_inEntering_rejected() {
            Position entering = stateMachine.apply(Position.flat(SYMBOL), entryAck("10", "100", "95")).getPosition();

            assertThatThrownBy(() -> stateMachine.apply(entering, exitAck()))
                    .isInstanceOf(IllegalTransitionException.class)
                    .hasMessageContaining("ENTERING -> CLOSING");
        }

        @Test
        @DisplayName("A cancelled entry is confirmed by ENTRY_ABORTED, not by an exit acknowledgement")
        void cancelledEntry_confirmedByAbort() {
            Position entering = stateMachine.apply(Position.flat(SYMBOL), entryAck("10", "100", "95")).getPosition();

            assertThat(stateMachine.admissibleMandates(entering.getState())).containsExactly(MandateType.EXIT);
            assertThatThrownBy(() -> stateMachine.apply(entering, exitAck()))
                    .isInstanceOf(IllegalTransitionException.class);
            assertThat(stateMachine.apply(entering, report(ExecutionReportType.ENTRY_ABORTED).build())
                    .getPosition().getState()).isEqualTo(PositionState.FLAT);
        }

        @Test
        @DisplayName("EXECUTION_FAILED moves any state but CLOSED to FAILED")
        void executionFailed_toFailed() {
            for (PositionState state : List.of(
                    PositionState.FLAT, PositionState.ENTERING, PositionState.OPEN,
                    PositionState.REDUCING, PositionState.CLOSING)) {
                Position position = open("10").toBuilder().state(state).build();

                Position failed = stateMachine.apply(position, report(ExecutionReportType.EXECUTION_FAILED).build())
                        .getPosition();

                assertThat(failed.getState()).as(state.name()).isEqualTo(PositionState.FAILED);
            }
        }

        @Test
        @DisplayName("EXECUTION_FAILED on CLOSED is rejected")
        void executionFailed_onClosed_rejected() {
            Position closed = Position.flat(SYMBOL).toBuilder().state(PositionState.CLOSED).build();

            assertThatThrownBy(() -> stateMachine.apply(closed, report(ExecutionReportType.EXECUTION_FAILED).build()))
                    .isInstanceOf(IllegalTransitionException.class);
        }

        @Test
        @DisplayName("A FAILED position with exposure leaves only through an exit")
        void failed_exitsThroughClosing() {
            Position failed = open("10").toBuilder().state(PositionState.FAILED).build();

            Position closing = stateMachine.apply(failed, exitAck()).getPosition();

            assertThat(closing.getState()).isEqualTo(PositionState.CLOSING);
        }

        @Test
        @DisplayName("resolveFailed walks a FAILED position without exposure back to FLAT")
        void resolveFailed_withoutExposure() {
            Position failed = Position.flat(SYMBOL).toBuilder().state(PositionState.FAILED).build();

            TransitionResult result = stateMachine.resolveFailed(failed);

            assertThat(result.getPosition().getState()).isEqualTo(PositionState.FLAT);
            assertThat(result.getTransitions()).extracting(LifecycleTransition::getTo)
                    .containsExactly(PositionState.CLOSING, PositionState.CLOSED, PositionState.FLAT);
            assertThat(result.getTransitions()).allSatisfy(t -> assertThat(t.getCause()).isNull());
        }

        @Test
        @DisplayName("resolveFailed refuses a FAILED position that still holds exposure")
        void resolveFailed_withExposure_rejected() {
            Position failed = open("10").toBuilder().state(PositionState.FAILED).build();

            assertThatThrownBy(() -> stateMachine.resolveFailed(failed))
                    .isInstanceOf(IllegalTransitionException.class);
        }

        @Test
        @DisplayName("A report for another symbol is rejected")
        void report_wrongSymbol_rejected() {
            ExecutionReport report = ExecutionReport.builder()
                    .symbol("ETHUSDT")
                    .type(ExecutionReportType.EXECUTION_FAILED)
                    .build();

            assertThatThrownBy(() -> stateMachine.apply(open("10"), report))
                    .isInstanceOf(IllegalTransitionException.class);
        }
    }

    // ==============================
    // HELPERS
    // ==============================

    private static Position open(String size) {
        return Position.builder()
                .symbol(SYMBOL)
                .direction(Direction.LONG)
                .size(new BigDecimal(size))
                .entryPrice(new BigDecimal("100"))
                .stopPrice(new BigDecimal("90"))
                .state(PositionState.OPEN)
                .build();
    }

    /** Any report type, mostly well-formed, sized against the current position. */
    private static ExecutionReport randomReport(Random random, Position position) {
        ExecutionReportType[] types = ExecutionReportType.values();
        ExecutionReportType type = types[random.nextInt(types.length)];
        MandateType mandateType = switch (type) {
            case ENTRY_ACKNOWLEDGED -> MandateType.ENTER;
            case ADD_FILLED -> MandateType.ADD;
            case REDUCE_ACKNOWLEDGED -> MandateType.REDUCE;
            case EXIT_ACKNOWLEDGED -> MandateType.EXIT;
            default -> null;
        };
        if (mandateType != null && random.nextInt(5) == 0) {
            mandateType = MandateType.values()[random.nextInt(MandateType.values().length)];
        }
        Direction direction = random.nextBoolean() ? Direction.LONG : Direction.SHORT;
        int held = position.getSize().intValue();
        BigDecimal quantity = BigDecimal.valueOf(1 + random.nextInt(Math.max(held, 1) + 1));

        ExecutionReport.ExecutionReportBuilder builder = report(type)
                .mandateType(mandateType)
                .quantity(quantity)
                .price(new BigDecimal("100"));
        switch (type) {
            case ENTRY_ACKNOWLEDGED -> builder
                    .direction(direction)
                    .stopPrice(new BigDecimal(direction == Direction.LONG ? "90" : "110"));
            case EXIT_FILLED -> {
                if (random.nextBoolean()) {
                    builder.quantity(null);
                }
            }
            default -> { }
        }
        return builder.build();
    }

    private static ExecutionReport.ExecutionReportBuilder report(ExecutionReportType type) {
        return ExecutionReport.builder().symbol(SYMBOL).type(type);
    }

    private static ExecutionReport entryAck(String quantity, String price, String stop) {
        return report(ExecutionReportType.ENTRY_ACKNOWLEDGED)
                .mandateType(MandateType.ENTER)
                .direction(Direction.LONG)
                .quantity(new BigDecimal(quantity))
                .price(new BigDecimal(price))
                .stopPrice(new BigDecimal(stop))
                .build();
    }

    private static ExecutionReport reduceAck() {
        return report(ExecutionReportType.REDUCE_ACKNOWLEDGED).mandateType(MandateType.REDUCE).build();
    }

    private static ExecutionReport exitAck() {
        return report(ExecutionReportType.EXIT_ACKNOWLEDGED).mandateType(MandateType.EXIT).build();
    }
}
