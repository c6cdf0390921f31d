package com.arbiter.unit.intent;

import static org.assertj.core.api.Assertions.assertThat;

import com.arbiter.arbitration.SyntheticMandates;
import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.ExecutionAction;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.enums.PriceType;
import com.arbiter.domain.enums.VerdictType;
import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.ExecutionIntent;
import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.Position;
import com.arbiter.intent.ExecutionIntentConstructor;
import com.arbiter.risk.CorrelationGroup;
import com.arbiter.risk.InvariantEvaluator;
import com.arbiter.risk.PortfolioFacts;
import com.arbiter.risk.PositionMetrics;
import com.arbiter.risk.RiskCalculator;
import com.arbiter.risk.RiskContext;
import com.arbiter.risk.RiskEnvelope;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExecutionIntentConstructor sizing: risk budget, exposure caps, liquidation
 * buffer, restoring reductions, scoped reductions and exits.
 */
class ExecutionIntentConstructorTest {

    private static final String SYMBOL = "BTCUSDT";

    private RiskCalculator riskCalculator;
    private ExecutionIntentConstructor constructor;
    private InvariantEvaluator evaluator;

    @BeforeEach
    void setUp() {
        riskCalculator = new RiskCalculator();
        constructor = new ExecutionIntentConstructor(riskCalculator);
        evaluator = new InvariantEvaluator(riskCalculator);
    }

    // ==============================
    // ENTER
    // ==============================

    @Nested
    @DisplayName("ENTER Sizing")
    class Enter {

        @Test
        @DisplayName("Size is the risk budget over the stop distance when the budget binds")
        void riskBudgetBinds() {
            Optional<ExecutionIntent> intent =
                    constructor.construct(context(Position.flat(SYMBOL), envelope()), enter(Direction.LONG, "95", null));

            assertThat(intent).isPresent();
            ExecutionIntent opening = intent.get();
            assertThat(opening.getAction()).isEqualTo(ExecutionAction.OPEN);
            assertThat(opening.getDirection()).isEqualTo(Direction.LONG);
            assertThat(opening.getQuantity()).isEqualByComparingTo("20");
            assertThat(opening.getPriceType()).isEqualTo(PriceType.MARKET);
            assertThat(opening.getStopPrice()).isEqualByComparingTo("95");
            assertThat(opening.getTriggerId()).isEqualTo("enter-1");
            assertThat(opening.getCycleId()).isEqualTo(7L);
        }

        @Test
        @DisplayName("A limit price makes a LIMIT intent and sets the stop distance")
        void limitEntry() {
            ExecutionIntent opening = constructor
                    .construct(context(Position.flat(SYMBOL), envelope()), enter(Direction.LONG, "95", "98"))
                    .orElseThrow();

            assertThat(opening.getPriceType()).isEqualTo(PriceType.LIMIT);
            assertThat(opening.getLimitPrice()).isEqualByComparingTo("98");
            // 100 / (98 - 95), rounded down to the step
            assertThat(opening.getQuantity()).isEqualByComparingTo("33.333");
        }

        @Test
        @DisplayName("A tight stop is bounded by the exposure cap instead")
        void exposureCapBinds() {
            ExecutionIntent opening = constructor
                    .construct(context(Position.flat(SYMBOL), envelope()), enter(Direction.LONG, "99.99", null))
                    .orElseThrow();

            assertThat(opening.getQuantity()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("Correlation group headroom bounds the entry")
        void groupHeadroomBinds() {
            RiskEnvelope grouped = envelopeBuilder()
                    .correlationGroup(CorrelationGroup.builder()
                            .name("majors")
                            .symbol("BTCUSDT")
                            .symbol("ETHUSDT")
                            .maxExposure(new BigDecimal("2.5"))
                            .hardCeiling(new BigDecimal("3.5"))
                            .build())
                    .build();
            PortfolioFacts facts = PortfolioFacts.builder()
                    .totalNotional(new BigDecimal("20000"))
                    .symbolNotional("ETHUSDT", new BigDecimal("20000"))
                    .groupNotional("majors", new BigDecimal("20000"))
                    .build();
            RiskContext context = context(Position.flat(SYMBOL), grouped).toBuilder().facts(facts).build();

            ExecutionIntent opening = constructor.construct(context, enter(Direction.LONG, "99.99", null)).orElseThrow();

            assertThat(opening.getQuantity()).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("A size that rounds to zero produces no intent")
        void zeroSize_noIntent() {
            RiskEnvelope coarse = envelopeBuilder().quantityStep(BigDecimal.ONE).build();

            Optional<ExecutionIntent> intent =
                    constructor.construct(context(Position.flat(SYMBOL), coarse), enter(Direction.SHORT, "250", null));

            assertThat(intent).isEmpty();
        }

        @Test
        @DisplayName("A stop on the wrong side produces no intent")
        void wrongSideStop_noIntent() {
            assertThat(constructor.construct(
                    context(Position.flat(SYMBOL), envelope()), enter(Direction.SHORT, "95", null))).isEmpty();
        }
    }

    // ==============================
    // ADD
    // ==============================

    @Nested
    @DisplayName("ADD Sizing")
    class Add {

        @Test
        @DisplayName("ADD is bounded by the risk budget left after the held position")
        void remainingBudget() {
            ExecutionIntent opening = constructor
                    .construct(context(open("10", "95"), envelope()), add(null))
                    .orElseThrow();

            assertThat(opening.getAction()).isEqualTo(ExecutionAction.OPEN);
            assertThat(opening.getDirection()).isEqualTo(Direction.LONG);
            assertThat(opening.getQuantity()).isEqualByComparingTo("10");
            assertThat(opening.getStopPrice()).isEqualByComparingTo("95");
        }

        @Test
        @DisplayName("A tighter stop on the ADD is carried and frees budget")
        void tighterStop() {
            ExecutionIntent opening = constructor
                    .construct(context(open("10", "95"), envelope()), add("97"))
                    .orElseThrow();

            assertThat(opening.getStopPrice()).isEqualByComparingTo("97");
            assertThat(opening.getQuantity()).isEqualByComparingTo("23.333");
        }

        @Test
        @DisplayName("A looser stop on the ADD is ignored")
        void looserStopIgnored() {
            ExecutionIntent opening = constructor
                    .construct(context(open("10", "95"), envelope()), add("90"))
                    .orElseThrow();

            assertThat(opening.getStopPrice()).isEqualByComparingTo("95");
        }

        @Test
        @DisplayName("No intent when the held position already uses the risk budget")
        void budgetExhausted() {
            assertThat(constructor.construct(context(open("20", "95"), envelope()), add(null))).isEmpty();
        }
    }

    // ==============================
    // REDUCE AND EXIT
    // ==============================

    @Nested
    @DisplayName("REDUCE and EXIT")
    class ReduceAndExit {

        @Test
        @DisplayName("With a cap breached the reduction is the smallest amount that restores it")
        void restoringReduction() {
            ExecutionIntent reduction = constructor
                    .construct(context(open("250", "99.9"), envelope()), reduce(null))
                    .orElseThrow();

            assertThat(reduction.getAction()).isEqualTo(ExecutionAction.REDUCE);
            assertThat(reduction.getQuantity()).isEqualByComparingTo("50");
            assertThat(reduction.getPriceType()).isEqualTo(PriceType.MARKET);
        }

        @Test
        @DisplayName("The restoring amount overrides a smaller requested scope")
        void restoringOverridesScope() {
            ExecutionIntent reduction = constructor
                    .construct(context(open("250", "99.9"), envelope()), reduce("0.01"))
                    .orElseThrow();

            assertThat(reduction.getQuantity()).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("Without a breach the requested scope is used")
        void scopedReduction() {
            ExecutionIntent reduction = constructor
                    .construct(context(open("10", "99.9"), envelope()), reduce("0.3"))
                    .orElseThrow();

            assertThat(reduction.getAction()).isEqualTo(ExecutionAction.REDUCE);
            assertThat(reduction.getQuantity()).isEqualByComparingTo("3");
            assertThat(reduction.getDirection()).isEqualTo(Direction.LONG);
        }

        @Test
        @DisplayName("A full-scope reduction closes the position")
        void fullScope_close() {
            ExecutionIntent reduction = constructor
                    .construct(context(open("10", "99.9"), envelope()), reduce("1"))
                    .orElseThrow();

            assertThat(reduction.getAction()).isEqualTo(ExecutionAction.CLOSE);
            assertThat(reduction.getQuantity()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("An unscoped reduction with nothing breached produces no intent")
        void unscopedHealthy_noIntent() {
            assertThat(constructor.construct(context(open("10", "99.9"), envelope()), reduce(null))).isEmpty();
        }

        @Test
        @DisplayName("EXIT closes the full size at market")
        void exit() {
            Mandate exit = Mandate.builder().triggerId("exit-1").type(MandateType.EXIT).symbol(SYMBOL).build();

            ExecutionIntent closing = constructor.construct(context(open("10", "95"), envelope()), exit).orElseThrow();

            assertThat(closing.getAction()).isEqualTo(ExecutionAction.CLOSE);
            assertThat(closing.getQuantity()).isEqualByComparingTo("10");
            assertThat(closing.getPriceType()).isEqualTo(PriceType.MARKET);
            assertThat(closing.getMandateType()).isEqualTo(MandateType.EXIT);
        }

        @Test
        @DisplayName("EXIT while the entry is still working cancels it at the requested size")
        void exit_enteringCancelsEntry() {
            Position entering = open("10", "95").toBuilder().state(PositionState.ENTERING).build();
            Mandate exit = Mandate.builder().triggerId("exit-1").type(MandateType.EXIT).symbol(SYMBOL).build();

            ExecutionIntent cancel = constructor.construct(context(entering, envelope()), exit).orElseThrow();

            assertThat(cancel.getAction()).isEqualTo(ExecutionAction.CLOSE);
            assertThat(cancel.getQuantity()).isEqualByComparingTo("10");
            assertThat(cancel.getDirection()).isEqualTo(Direction.LONG);
        }

        @Test
        @DisplayName("HOLD and BLOCK produce no intent")
        void restrictions_noIntent() {
            Mandate hold = Mandate.builder().triggerId("hold-1").type(MandateType.HOLD).symbol(SYMBOL).build();
            Mandate block = Mandate.builder().triggerId("block-1").type(MandateType.BLOCK).symbol(SYMBOL).build();

            assertThat(constructor.construct(context(open("10", "95"), envelope()), hold)).isEmpty();
            assertThat(constructor.construct(context(open("10", "95"), envelope()), block)).isEmpty();
        }
    }

    // ==============================
    // SOUNDNESS
    // ==============================

    @Nested
    @DisplayName("Soundness")
    class Soundness {

        @Test
        @DisplayName("No constructed entry projects outside any cap")
        void entriesNeverBreachCaps() {
            Random random = new Random(20240611L);
            RiskEnvelope envelope = envelope();
            int constructed = 0;

            for (int i = 0; i < 500; i++) {
                BigDecimal equity = BigDecimal.valueOf(1_000 + random.nextInt(99_000));
                BigDecimal mark = BigDecimal.valueOf(10 + random.nextInt(990)).add(BigDecimal.valueOf(random.nextInt(100), 2));
                BigDecimal stopFraction = BigDecimal.valueOf(1 + random.nextInt(200), 3);
                Direction direction = random.nextBoolean() ? Direction.LONG : Direction.SHORT;
                BigDecimal offset = mark.multiply(stopFraction).setScale(2, RoundingMode.UP);
                BigDecimal stop = direction == Direction.LONG ? mark.subtract(offset) : mark.add(offset);

                RiskContext context = RiskContext.builder()
                        .cycleId(i)
                        .position(Position.flat(SYMBOL))
                        .account(AccountSnapshot.of(equity))
                        .envelope(envelope)
                        .markPrice(mark)
                        .build();
                Mandate mandate = Mandate.builder()
                        .triggerId("enter-" + i)
                        .type(MandateType.ENTER)
                        .symbol(SYMBOL)
                        .direction(direction)
                        .stopPrice(stop)
                        .build();

                Optional<ExecutionIntent> intent = constructor.construct(context, mandate);
                if (intent.isEmpty()) {
                    continue;
                }
                constructed++;

                Position projected = Position.builder()
                        .symbol(SYMBOL)
                        .direction(direction)
                        .size(intent.get().getQuantity())
                        .entryPrice(mark)
                        .stopPrice(stop)
                        .state(PositionState.OPEN)
                        .build();
                PositionMetrics metrics = riskCalculator.project(
                        projected, mark, context.getAccount(), envelope, PortfolioFacts.empty());

                assertThat(metrics.getEffectiveLeverage()).isLessThanOrEqualTo(envelope.getMaxEffectiveLeverage());
                assertThat(metrics.getSymbolExposure()).isLessThanOrEqualTo(envelope.getMaxSymbolExposure());
                assertThat(metrics.getAccountExposure()).isLessThanOrEqualTo(envelope.getMaxAccountExposure());
                assertThat(metrics.getRiskAtStop()).isLessThanOrEqualTo(metrics.getRiskBudget());
                assertThat(metrics.getLiquidationDistance())
                        .isGreaterThanOrEqualTo(envelope.getMinLiquidationBuffer());
            }

            assertThat(constructed).isGreaterThan(400);
        }

        @Test
        @DisplayName("No admitted ADD projects the combined position outside any cap")
        void addsNeverBreachCaps() {
            Random random = new Random(20240612L);
            RiskEnvelope envelope = envelope();
            int constructed = 0;

            for (int i = 0; i < 500; i++) {
                BigDecimal equity = BigDecimal.valueOf(10_000 + random.nextInt(90_000));
                BigDecimal entry = BigDecimal.valueOf(10 + random.nextInt(990)).add(BigDecimal.valueOf(random.nextInt(100), 2));
                Direction direction = random.nextBoolean() ? Direction.LONG : Direction.SHORT;
                BigDecimal exposure = BigDecimal.valueOf(50 + random.nextInt(451), 3);
                BigDecimal stopFraction = BigDecimal.valueOf(5 + random.nextInt(16), 3);
                BigDecimal size = riskCalculator.floorToStep(
                        equity.multiply(exposure).divide(entry, RiskCalculator.MC), envelope);
                BigDecimal offset = entry.multiply(stopFraction).setScale(2, RoundingMode.UP);
                BigDecimal stop = direction == Direction.LONG ? entry.subtract(offset) : entry.add(offset);

                boolean lossSide = random.nextInt(10) >= 7;
                BigDecimal mark;
                if (lossSide) {
                    BigDecimal half = offset.divide(BigDecimal.valueOf(2));
                    mark = direction == Direction.LONG ? entry.subtract(half) : entry.add(half);
                } else {
                    BigDecimal move = entry.multiply(BigDecimal.valueOf(random.nextInt(50), 3)).setScale(2, RoundingMode.DOWN);
                    mark = direction == Direction.LONG ? entry.add(move) : entry.subtract(move);
                }

                Position position = Position.builder()
                        .symbol(SYMBOL)
                        .direction(direction)
                        .size(size)
                        .entryPrice(entry)
                        .stopPrice(stop)
                        .state(PositionState.OPEN)
                        .build();
                RiskContext context = RiskContext.builder()
                        .cycleId(i)
                        .position(position)
                        .account(AccountSnapshot.of(equity))
                        .envelope(envelope)
                        .markPrice(mark)
                        .build();
                Mandate mandate = Mandate.builder()
                        .triggerId("add-" + i)
                        .type(MandateType.ADD)
                        .symbol(SYMBOL)
                        .direction(direction)
                        .build();

                boolean admitted = evaluator.evaluate(context, mandate).isAllowed();
                if (lossSide) {
                    assertThat(admitted).as("ADD on the loss side of the entry, case %d", i).isFalse();
                    continue;
                }
                if (!admitted) {
                    continue;
                }
                Optional<ExecutionIntent> intent = constructor.construct(context, mandate);
                if (intent.isEmpty()) {
                    continue;
                }
                constructed++;

                ExecutionIntent adding = intent.get();
                assertThat(adding.getAction()).isEqualTo(ExecutionAction.OPEN);
                assertThat(adding.getDirection()).isEqualTo(direction);
                BigDecimal total = size.add(adding.getQuantity());
                BigDecimal averageEntry = entry.multiply(size).add(mark.multiply(adding.getQuantity()))
                        .divide(total, RiskCalculator.MC);
                Position projected = position.toBuilder()
                        .size(total)
                        .entryPrice(averageEntry)
                        .stopPrice(adding.getStopPrice())
                        .build();
                PositionMetrics metrics = riskCalculator.project(
                        projected, mark, context.getAccount(), envelope, PortfolioFacts.empty());

                assertThat(breachesCaps(metrics, envelope)).as("ADD case %d", i).isFalse();
                assertThat(metrics.getLiquidationDistance())
                        .isGreaterThanOrEqualTo(envelope.getMinLiquidationBuffer());
            }

            assertThat(constructed).isGreaterThan(200);
        }

        @Test
        @DisplayName("Every REDUCE improves the position; a forced one restores every cap and is not one step larger than needed")
        void reductionsAreUsefulAndMinimal() {
            Random random = new Random(20240613L);
            RiskEnvelope envelope = envelope();
            int forcedSeen = 0;
            int forcedConstructed = 0;
            int scopedConstructed = 0;

            for (int i = 0; i < 500; i++) {
                BigDecimal equity = BigDecimal.valueOf(10_000 + random.nextInt(90_000));
                BigDecimal entry = BigDecimal.valueOf(10 + random.nextInt(990)).add(BigDecimal.valueOf(random.nextInt(100), 2));
                Direction direction = random.nextBoolean() ? Direction.LONG : Direction.SHORT;
                BigDecimal exposure = BigDecimal.valueOf(50 + random.nextInt(2951), 3);
                BigDecimal stopFraction = BigDecimal.valueOf(5 + random.nextInt(26), 3);
                BigDecimal size = riskCalculator.floorToStep(
                        equity.multiply(exposure).divide(entry, RiskCalculator.MC), envelope);
                BigDecimal offset = entry.multiply(stopFraction).setScale(2, RoundingMode.UP);
                BigDecimal stop = direction == Direction.LONG ? entry.subtract(offset) : entry.add(offset);

                Position position = Position.builder()
                        .symbol(SYMBOL)
                        .direction(direction)
                        .size(size)
                        .entryPrice(entry)
                        .stopPrice(stop)
                        .state(PositionState.OPEN)
                        .build();
                AccountSnapshot account = AccountSnapshot.of(equity);
                RiskContext context = RiskContext.builder()
                        .cycleId(i)
                        .position(position)
                        .account(account)
                        .envelope(envelope)
                        .markPrice(entry)
                        .build();

                VerdictType assessed = evaluator.assess(context).getForced();
                assertThat(assessed).isNotEqualTo(VerdictType.FORCE_EXIT);
                boolean forced = assessed == VerdictType.FORCE_REDUCE;
                Mandate mandate;
                if (forced) {
                    forcedSeen++;
                    mandate = SyntheticMandates.forced(position, MandateType.REDUCE, i);
                } else {
                    mandate = reduce(BigDecimal.valueOf(1 + random.nextInt(100), 2).toPlainString());
                    if (!evaluator.evaluate(context, mandate).isAllowed()) {
                        continue;
                    }
                }

                Optional<ExecutionIntent> intent = constructor.construct(context, mandate);
                if (forced) {
                    assertThat(intent).as("forced REDUCE case %d", i).isPresent();
                }
                if (intent.isEmpty()) {
                    continue;
                }

                BigDecimal quantity = intent.get().getQuantity();
                assertThat(quantity).isPositive().isLessThanOrEqualTo(size);
                PositionMetrics before = riskCalculator.measure(position, entry, account, envelope, PortfolioFacts.empty());
                PositionMetrics after = riskCalculator.project(
                        position.toBuilder().size(size.subtract(quantity)).build(),
                        entry, account, envelope, PortfolioFacts.empty());
                boolean improves = after.getEffectiveLeverage().compareTo(before.getEffectiveLeverage()) < 0
                        || after.getLiquidationDistance().compareTo(before.getLiquidationDistance()) > 0
                        || after.getAccountExposure().compareTo(before.getAccountExposure()) < 0;
                assertThat(improves).as("REDUCE case %d", i).isTrue();

                if (!forced) {
                    scopedConstructed++;
                    continue;
                }
                forcedConstructed++;
                assertThat(breachesCaps(after, envelope)).as("restored, case %d", i).isFalse();
                PositionMetrics oneStepLess = riskCalculator.project(
                        position.toBuilder().size(size.subtract(quantity).add(envelope.getQuantityStep())).build(),
                        entry, account, envelope, PortfolioFacts.empty());
                assertThat(breachesCaps(oneStepLess, envelope)).as("minimal, case %d", i).isTrue();
            }

            assertThat(forcedSeen).isGreaterThan(100);
            assertThat(forcedConstructed).isEqualTo(forcedSeen);
            assertThat(scopedConstructed).isGreaterThan(50);
        }
    }

    // ==============================
    // HELPERS
    // ==============================

    private static RiskEnvelope.RiskEnvelopeBuilder envelopeBuilder() {
        return RiskEnvelope.builder()
                .maxRiskPerTrade(new BigDecimal("0.01"))
                .maxAccountExposure(new BigDecimal("3"))
                .maxSymbolExposure(new BigDecimal("2"))
                .minLiquidationBuffer(new BigDecimal("0.10"))
                .maxEffectiveLeverage(new BigDecimal("2"))
                .maintenanceMarginRate(new BigDecimal("0.005"))
                .hardExposureCeiling(new BigDecimal("4"))
                .quantityStep(new BigDecimal("0.001"));
    }

    private static RiskEnvelope envelope() {
        return envelopeBuilder().build();
    }

    private static boolean breachesCaps(PositionMetrics metrics, RiskEnvelope envelope) {
        return metrics.getEffectiveLeverage().compareTo(envelope.getMaxEffectiveLeverage()) > 0
                || metrics.getSymbolExposure().compareTo(envelope.getMaxSymbolExposure()) > 0
                || metrics.getAccountExposure().compareTo(envelope.getMaxAccountExposure()) > 0
                || metrics.getRiskAtStop().compareTo(metrics.getRiskBudget()) > 0;
    }

    private static RiskContext context(Position position, RiskEnvelope envelope) {
        return RiskContext.builder()
                .cycleId(7L)
                .position(position)
                .account(AccountSnapshot.of(new BigDecimal("10000")))
                .envelope(envelope)
                .markPrice(new BigDecimal("100"))
                .build();
    }

    private static Position open(String size, String stop) {
        return Position.builder()
                .symbol(SYMBOL)
                .direction(Direction.LONG)
                .size(new BigDecimal(size))
                .entryPrice(new BigDecimal("100"))
                .stopPrice(new BigDecimal(stop))
                .state(PositionState.OPEN)
                .build();
    }

    private static Mandate enter(Direction direction, String stop, String limit) {
        return Mandate.builder()
                .triggerId("enter-1")
                .type(MandateType.ENTER)
                .symbol(SYMBOL)
                .direction(direction)
                .stopPrice(new BigDecimal(stop))
                .limitPrice(limit != null ? new BigDecimal(limit) : null)
                .build();
    }

    private static Mandate add(String stop) {
        return Mandate.builder()
                .triggerId("add-1")
                .type(MandateType.ADD)
                .symbol(SYMBOL)
                .direction(Direction.LONG)
                .stopPrice(stop != null ? new BigDecimal(stop) : null)
                .build();
    }

    private static Mandate reduce(String scope) {
        return Mandate.builder()
                .triggerId("reduce-1")
                .type(MandateType.REDUCE)
                .symbol(SYMBOL)
                .scopeFraction(scope != null ? new BigDecimal(scope) : null)
                .build();
    }
}
