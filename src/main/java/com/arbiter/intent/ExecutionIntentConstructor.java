package com.arbiter.intent;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.ExecutionAction;
import com.arbiter.domain.enums.PriceType;
import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.ExecutionIntent;
import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.Position;
import com.arbiter.risk.CorrelationGroup;
import com.arbiter.risk.InvariantEvaluator;
import com.arbiter.risk.PositionMetrics;
import com.arbiter.risk.RiskCalculator;
import com.arbiter.risk.RiskContext;
import com.arbiter.risk.RiskEnvelope;
import com.arbiter.risk.SizeLimits;
import com.arbiter.risk.StopRules;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns the selected mandate into one atomic {@link ExecutionIntent}, or nothing.
 *
 * <p>Sizing per mandate type:
 * <ul>
 *   <li><b>ENTER:</b> {@code min(riskBudget / stopDistance, exposureCap / price, liquidationSafeNotional / price)},
 *       rounded down to the quantity step. Zero means the entry is suppressed; no cap is relaxed.</li>
 *   <li><b>ADD:</b> the same three bounds applied to the combined position, minus what is already held.
 *       The stop can only tighten.</li>
 *   <li><b>REDUCE:</b> with an invariant violated, the smallest reduction that brings the position back
 *       under every cap at once (rounded up to the step). Otherwise the requested scope of the size
 *       (rounded down).</li>
 *   <li><b>EXIT:</b> the full remaining size at market.</li>
 * </ul>
 *
 * <p>Every cap is monotone in size, so the tightest cap restores all of them together. Risk-increasing
 * sizes are verified against a projection of the post-intent position and stepped down one quantity step
 * at a time while the projection still breaches a cap, which absorbs decimal rounding at cap boundaries.
 *
 * <p>Notional is valued at the higher of mark and limit price, which over-counts exposure for limit
 * entries below the mark and never under-counts it.
 */
@Service
public class ExecutionIntentConstructor {

    private static final Logger log = LoggerFactory.getLogger(ExecutionIntentConstructor.class);

    /** Upper bound on step-down iterations before a size is declared infeasible. */
    static final int MAX_STEP_DOWNS = 1000;

    private final RiskCalculator riskCalculator;

    public ExecutionIntentConstructor(RiskCalculator riskCalculator) {
        this.riskCalculator = riskCalculator;
    }

    public Optional<ExecutionIntent> construct(RiskContext context, Mandate mandate) {
        Optional<ExecutionIntent> intent = switch (mandate.getType()) {
            case ENTER -> constructEntry(context, mandate);
            case ADD -> constructAdd(context, mandate);
            case REDUCE -> constructReduce(context, mandate);
            case EXIT -> constructExit(context, mandate);
            case HOLD, BLOCK -> Optional.empty();
        };
        if (intent.isEmpty() && !mandate.getType().isRestriction()) {
            log.warn("{} cycle {}: no feasible size for {} {}",
                    context.getSymbol(), context.getCycleId(), mandate.getType(), mandate.getTriggerId());
        }
        return intent;
    }

    // ---- ENTER ----

    private Optional<ExecutionIntent> constructEntry(RiskContext context, Mandate mandate) {
        AccountSnapshot account = context.getAccount();
        BigDecimal mark = context.getMarkPrice();
        BigDecimal entry = InvariantEvaluator.entryReference(context, mandate);
        Direction direction = mandate.getDirection();
        BigDecimal stop = mandate.getStopPrice();
        if (!account.isSolvent() || mark == null || entry == null
                || !StopRules.isProtective(direction, stop, entry)) {
            return Optional.empty();
        }

        RiskEnvelope envelope = context.getEnvelope();
        BigDecimal valuation = mark.max(entry);
        SizeLimits limits = riskCalculator.sizeLimits(context.getSymbol(), account, envelope, context.getFacts());

        BigDecimal stopDistance = entry.subtract(stop).abs();
        BigDecimal riskSize = limits.getRiskBudget().divide(stopDistance, RiskCalculator.MC);
        BigDecimal capSize = limits.exposureCapNotional().divide(valuation, RiskCalculator.MC);
        BigDecimal liquidationSize = limits.getLiquidationSafeNotional().divide(valuation, RiskCalculator.MC);

        BigDecimal size = riskCalculator.floorToStep(riskSize.min(capSize).min(liquidationSize), envelope);

        Position template = Position.builder()
                .symbol(context.getSymbol())
                .direction(direction)
                .entryPrice(entry)
                .stopPrice(stop)
                .build();
        size = stepDownUntilSafe(template, BigDecimal.ZERO, size, valuation, context);
        if (size.signum() <= 0) {
            return Optional.empty();
        }

        return Optional.of(opening(context, mandate, direction, size, stop));
    }

    // ---- ADD ----

    private Optional<ExecutionIntent> constructAdd(RiskContext context, Mandate mandate) {
        Position position = context.getPosition();
        AccountSnapshot account = context.getAccount();
        BigDecimal mark = context.getMarkPrice();
        BigDecimal entry = InvariantEvaluator.entryReference(context, mandate);
        Direction direction = position.getDirection();
        BigDecimal stop = StopRules.tighter(direction, position.getStopPrice(), mandate.getStopPrice());
        if (!account.isSolvent() || !position.hasExposure() || mark == null || entry == null
                || !StopRules.isProtective(direction, stop, entry)
                || !StopRules.isProtective(direction, stop, mark)) {
            return Optional.empty();
        }

        RiskEnvelope envelope = context.getEnvelope();
        BigDecimal valuation = mark.max(entry);
        SizeLimits limits = riskCalculator.sizeLimits(context.getSymbol(), account, envelope, context.getFacts());

        BigDecimal heldNotional = position.notional(valuation);
        BigDecimal notionalRoom = limits.maxNotional().subtract(heldNotional);

        Position tightened = position.toBuilder().stopPrice(stop).build();
        BigDecimal riskRoom = limits.getRiskBudget().subtract(tightened.riskAtStop());
        BigDecimal stopDistance = entry.subtract(stop).abs();
        if (notionalRoom.signum() <= 0 || riskRoom.signum() <= 0) {
            return Optional.empty();
        }

        BigDecimal capSize = notionalRoom.divide(valuation, RiskCalculator.MC);
        BigDecimal riskSize = riskRoom.divide(stopDistance, RiskCalculator.MC);
        BigDecimal size = riskCalculator.floorToStep(capSize.min(riskSize), envelope);

        size = stepDownUntilSafe(tightened, position.getSize(), size, valuation, context, entry);
        if (size.signum() <= 0) {
            return Optional.empty();
        }

        return Optional.of(opening(context, mandate, direction, size, stop));
    }

    // ---- REDUCE ----

    private Optional<ExecutionIntent> constructReduce(RiskContext context, Mandate mandate) {
        Position position = context.getPosition();
        AccountSnapshot account = context.getAccount();
        BigDecimal mark = context.referencePrice();
        if (!position.hasExposure() || !account.isSolvent() || mark == null) {
            return Optional.empty();
        }

        RiskEnvelope envelope = context.getEnvelope();
        PositionMetrics before = riskCalculator.measure(position, mark, account, envelope, context.getFacts());

        BigDecimal quantity;
        if (breachesCaps(before, envelope)) {
            quantity = restoringReduction(context, mark);
        } else if (mandate.getScopeFraction() != null) {
            quantity = riskCalculator.floorToStep(mandate.requestedReduction(position), envelope);
        } else {
            return Optional.empty();
        }
        quantity = quantity.min(position.getSize());
        if (quantity.signum() <= 0) {
            return Optional.empty();
        }

        Position reduced = position.toBuilder().size(position.getSize().subtract(quantity)).build();
        PositionMetrics after = riskCalculator.project(reduced, mark, account, envelope, context.getFacts());
        if (!improves(before, after)) {
            return Optional.empty();
        }

        boolean full = quantity.compareTo(position.getSize()) == 0;
        return Optional.of(ExecutionIntent.builder()
                .cycleId(context.getCycleId())
                .symbol(context.getSymbol())
                .action(full ? ExecutionAction.CLOSE : ExecutionAction.REDUCE)
                .direction(position.getDirection())
                .quantity(quantity)
                .priceType(PriceType.MARKET)
                .stopPrice(position.getStopPrice())
                .mandateType(mandate.getType())
                .triggerId(mandate.getTriggerId())
                .build());
    }

    /**
     * Smallest reduction restoring every size cap: size minus the tightest cap expressed as a size,
     * rounded up to the step. Leverage, symbol, account and group exposure bound the notional at the
     * mark; the risk budget bounds {@code size × |entry − stop|}.
     */
    private BigDecimal restoringReduction(RiskContext context, BigDecimal mark) {
        Position position = context.getPosition();
        RiskEnvelope envelope = context.getEnvelope();
        SizeLimits limits =
                riskCalculator.sizeLimits(context.getSymbol(), context.getAccount(), envelope, context.getFacts());

        BigDecimal target = limits.exposureCapNotional().divide(mark, RiskCalculator.MC);
        if (position.getEntryPrice() != null && position.getStopPrice() != null) {
            BigDecimal stopDistance = position.getEntryPrice().subtract(position.getStopPrice()).abs();
            if (stopDistance.signum() > 0) {
                target = target.min(limits.getRiskBudget().divide(stopDistance, RiskCalculator.MC));
            }
        }
        target = target.max(BigDecimal.ZERO);
        return riskCalculator.ceilToStep(position.getSize().subtract(target), envelope);
    }

    // ---- EXIT ----

    private Optional<ExecutionIntent> constructExit(RiskContext context, Mandate mandate) {
        Position position = context.getPosition();
        if (position.getSize().signum() <= 0 || !position.getDirection().isDirectional()) {
            return Optional.empty();
        }
        return Optional.of(ExecutionIntent.builder()
                .cycleId(context.getCycleId())
                .symbol(context.getSymbol())
                .action(ExecutionAction.CLOSE)
                .direction(position.getDirection())
                .quantity(position.getSize())
                .priceType(PriceType.MARKET)
                .stopPrice(position.getStopPrice())
                .mandateType(mandate.getType())
                .triggerId(mandate.getTriggerId())
                .build());
    }

    // ---- Verification ----

    private BigDecimal stepDownUntilSafe(
            Position template, BigDecimal held, BigDecimal size, BigDecimal valuation, RiskContext context) {
        return stepDownUntilSafe(template, held, size, valuation, context, template.getEntryPrice());
    }

    /**
     * Decrements {@code size} one quantity step at a time until the combined position
     * ({@code held + size}, entry averaged) projects inside every cap.
     */
    private BigDecimal stepDownUntilSafe(
            Position template,
            BigDecimal held,
            BigDecimal size,
            BigDecimal valuation,
            RiskContext context,
            BigDecimal addedEntry) {
        RiskEnvelope envelope = context.getEnvelope();
        BigDecimal step = envelope.getQuantityStep();

        for (int i = 0; i < MAX_STEP_DOWNS && size.signum() > 0; i++) {
            BigDecimal total = held.add(size);
            BigDecimal averageEntry = held.signum() == 0 || template.getEntryPrice() == null
                    ? addedEntry
                    : template.getEntryPrice().multiply(held).add(addedEntry.multiply(size))
                            .divide(total, RiskCalculator.MC);
            Position projected = template.toBuilder()
                    .size(total)
                    .entryPrice(averageEntry)
                    .liquidationPrice(null)
                    .build();
            PositionMetrics metrics = riskCalculator.project(
                    projected, valuation, context.getAccount(), envelope, context.getFacts());
            if (!breachesCaps(metrics, envelope)) {
                return size;
            }
            size = size.subtract(step);
        }
        return BigDecimal.ZERO;
    }

    /** True when any cap is breached, liquidation buffer included. */
    static boolean breachesCaps(PositionMetrics metrics, RiskEnvelope envelope) {
        if (metrics.getEffectiveLeverage().compareTo(envelope.getMaxEffectiveLeverage()) > 0
                || metrics.getSymbolExposure().compareTo(envelope.getMaxSymbolExposure()) > 0
                || metrics.getAccountExposure().compareTo(envelope.getMaxAccountExposure()) > 0
                || metrics.getRiskAtStop().compareTo(metrics.getRiskBudget()) > 0) {
            return true;
        }
        for (CorrelationGroup group : envelope.getCorrelationGroups()) {
            BigDecimal exposure = metrics.getGroupExposures().get(group.getName());
            if (exposure != null && exposure.compareTo(group.getMaxExposure()) > 0) {
                return true;
            }
        }
        return metrics.getNotional().signum() > 0
                && metrics.getLiquidationDistance().compareTo(envelope.getMinLiquidationBuffer()) < 0;
    }

    private static boolean improves(PositionMetrics before, PositionMetrics after) {
        return after.getEffectiveLeverage().compareTo(before.getEffectiveLeverage()) < 0
                || after.getAccountExposure().compareTo(before.getAccountExposure()) < 0
                || after.getLiquidationDistance().compareTo(before.getLiquidationDistance()) > 0;
    }

    private static ExecutionIntent opening(
            RiskContext context, Mandate mandate, Direction direction, BigDecimal size, BigDecimal stop) {
        boolean limit = mandate.getLimitPrice() != null;
        return ExecutionIntent.builder()
                .cycleId(context.getCycleId())
                .symbol(context.getSymbol())
                .action(ExecutionAction.OPEN)
                .direction(direction)
                .quantity(size)
                .priceType(limit ? PriceType.LIMIT : PriceType.MARKET)
                .limitPrice(mandate.getLimitPrice())
                .stopPrice(stop)
                .mandateType(mandate.getType())
                .triggerId(mandate.getTriggerId())
                .build();
    }
}
