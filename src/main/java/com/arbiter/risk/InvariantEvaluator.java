package com.arbiter.risk;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.enums.PositionState;
import com.arbiter.domain.enums.VerdictType;
import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.Mandate;
import com.arbiter.domain.model.Position;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Evaluates mandates against the risk invariants.
 *
 * <p>Two entry points:
 * <ul>
 *   <li>{@link #assess(RiskContext)}: the position as it stands, independent of any mandate.
 *       A breach here forces a reduction or an exit.</li>
 *   <li>{@link #evaluate(RiskContext, Mandate)}: one mandate against the position, the account
 *       and the portfolio facts. Returns ALLOW, DENY or a FORCE verdict.</li>
 * </ul>
 *
 * <p>Severity ordering of the position checks:
 * <ol>
 *   <li>FAILED lifecycle, non-positive equity, liquidation buffer breached: FORCE_EXIT</li>
 *   <li>Leverage, symbol/account/group exposure, loss at stop over cap: FORCE_REDUCE</li>
 * </ol>
 *
 * <p>Pure: no state, no I/O. The same context and mandate always give the same verdict.
 */
@Service
@RequiredArgsConstructor
public class InvariantEvaluator {

    private final RiskCalculator riskCalculator;

    // ---- Position assessment ----

    public PositionAssessment assess(RiskContext context) {
        Position position = context.getPosition();

        if (position.getState() == PositionState.FAILED) {
            return PositionAssessment.builder()
                    .forced(VerdictType.FORCE_EXIT)
                    .violation(RiskViolation.of(
                            "POSITION_FAILED",
                            InvariantKind.LIFECYCLE,
                            "Position " + position.getSymbol() + " is FAILED, only an exit is safe"))
                    .build();
        }

        // Exposure that is not yet confirmed (ENTERING) or already being closed is not assessed
        if (!isAssessable(position)) {
            return PositionAssessment.clear();
        }

        AccountSnapshot account = context.getAccount();
        if (!account.isSolvent()) {
            return PositionAssessment.builder()
                    .forced(VerdictType.FORCE_EXIT)
                    .violation(RiskViolation.of(
                            "EQUITY_NON_POSITIVE",
                            InvariantKind.EQUITY,
                            "Equity " + account.getEquity() + " with open exposure on " + position.getSymbol()))
                    .build();
        }

        BigDecimal price = context.referencePrice();
        if (price == null) {
            return PositionAssessment.clear();
        }

        RiskEnvelope envelope = context.getEnvelope();
        PositionMetrics metrics =
                riskCalculator.measure(position, price, account, envelope, context.getFacts());

        List<RiskViolation> exitViolations = new ArrayList<>();
        List<RiskViolation> reduceViolations = new ArrayList<>();

        if (metrics.getLiquidationDistance().compareTo(envelope.getMinLiquidationBuffer()) < 0) {
            exitViolations.add(RiskViolation.of(
                    "LIQUIDATION_BUFFER_BREACHED",
                    InvariantKind.LIQUIDATION_BUFFER,
                    String.format("Liquidation distance %s below minimum %s (liq %s, mark %s)",
                            metrics.getLiquidationDistance(), envelope.getMinLiquidationBuffer(),
                            metrics.getLiquidationPrice(), price)));
        }
        reduceViolations.addAll(capViolations(metrics, envelope));

        List<RiskViolation> all = new ArrayList<>(exitViolations);
        all.addAll(reduceViolations);

        VerdictType forced = !exitViolations.isEmpty()
                ? VerdictType.FORCE_EXIT
                : !reduceViolations.isEmpty() ? VerdictType.FORCE_REDUCE : VerdictType.ALLOW;

        return PositionAssessment.builder()
                .forced(forced)
                .metrics(metrics)
                .violations(all)
                .build();
    }

    // ---- Mandate evaluation ----

    public InvariantVerdict evaluate(RiskContext context, Mandate mandate) {
        // An exit never increases risk and is never blocked
        if (mandate.getType() == MandateType.EXIT) {
            return InvariantVerdict.allow();
        }

        PositionAssessment assessment = assess(context);
        if (assessment.getForced() == VerdictType.FORCE_EXIT) {
            return InvariantVerdict.force(VerdictType.FORCE_EXIT, assessment.getViolations());
        }
        if (assessment.getForced() == VerdictType.FORCE_REDUCE && mandate.getType() != MandateType.REDUCE) {
            return InvariantVerdict.force(VerdictType.FORCE_REDUCE, assessment.getViolations());
        }

        List<RiskViolation> violations = switch (mandate.getType()) {
            case ENTER -> checkRiskIncrease(context, mandate, false);
            case ADD -> checkRiskIncrease(context, mandate, true);
            case REDUCE -> checkReduction(context, mandate, assessment);
            case HOLD, BLOCK, EXIT -> List.of();
        };
        return violations.isEmpty() ? InvariantVerdict.allow() : InvariantVerdict.deny(violations);
    }

    /** Entry reference price of a risk-increasing mandate: its limit price, else the mark. */
    public static BigDecimal entryReference(RiskContext context, Mandate mandate) {
        return mandate.getLimitPrice() != null ? mandate.getLimitPrice() : context.getMarkPrice();
    }

    // ---- ENTER / ADD ----

    /** Adding LONG below the existing entry, or SHORT above it, adds to a losing position. */
    static boolean isAveragingDown(Direction direction, BigDecimal existingEntry, BigDecimal addPrice) {
        if (existingEntry == null || !direction.isDirectional()) {
            return false;
        }
        int cmp = addPrice.compareTo(existingEntry);
        return direction == Direction.LONG ? cmp < 0 : cmp > 0;
    }

    private List<RiskViolation> checkRiskIncrease(RiskContext context, Mandate mandate, boolean adding) {
        List<RiskViolation> violations = new ArrayList<>();
        Position position = context.getPosition();
        AccountSnapshot account = context.getAccount();
        String symbol = context.getSymbol();

        if (!account.isSolvent()) {
            violations.add(RiskViolation.of(
                    "EQUITY_NON_POSITIVE",
                    InvariantKind.EQUITY,
                    "Equity " + account.getEquity() + " forbids any risk increase"));
            return violations;
        }

        BigDecimal price = entryReference(context, mandate);
        if (price == null || price.signum() <= 0) {
            violations.add(RiskViolation.of(
                    "PRICE_UNAVAILABLE", InvariantKind.PRICE, "No usable price for " + symbol + " this cycle"));
            return violations;
        }

        Direction direction;
        BigDecimal stop;
        if (adding) {
            direction = position.getDirection();
            if (mandate.getDirection().isDirectional() && mandate.getDirection() != direction) {
                violations.add(RiskViolation.of(
                        "DIRECTION_MISMATCH",
                        InvariantKind.DIRECTION,
                        "ADD " + mandate.getDirection() + " against open " + direction + " position"));
            }
            if (isAveragingDown(direction, position.getEntryPrice(), price)) {
                violations.add(RiskViolation.of(
                        "AVERAGING_DOWN",
                        InvariantKind.AVERAGING_DOWN,
                        "ADD at " + price + " is on the loss side of the " + direction
                                + " entry " + position.getEntryPrice()));
            }
            stop = StopRules.tighter(direction, position.getStopPrice(), mandate.getStopPrice());
        } else {
            direction = mandate.getDirection();
            if (!direction.isDirectional()) {
                violations.add(RiskViolation.of(
                        "DIRECTION_MISSING", InvariantKind.DIRECTION, "ENTER requires LONG or SHORT"));
            }
            stop = mandate.getStopPrice();
        }

        if (stop == null) {
            violations.add(RiskViolation.of(
                    "STOP_MISSING", InvariantKind.STOP, "A risk-increasing mandate requires a protective stop"));
        } else if (direction.isDirectional() && !StopRules.isProtective(direction, stop, price)) {
            violations.add(RiskViolation.of(
                    "STOP_WRONG_SIDE",
                    InvariantKind.STOP,
                    "Stop " + stop + " is not on the loss side of " + price + " for " + direction));
        }

        if (context.getFacts().isRiskIncreaseDenied(symbol)) {
            violations.add(RiskViolation.of(
                    "PORTFOLIO_CAP_REACHED",
                    context.getFacts().isAccountCapReached()
                            ? InvariantKind.ACCOUNT_EXPOSURE
                            : InvariantKind.CORRELATION_EXPOSURE,
                    "Portfolio exposure cap reached, no risk increase on " + symbol));
        }

        SizeLimits limits =
                riskCalculator.sizeLimits(symbol, account, context.getEnvelope(), context.getFacts());
        BigDecimal markForHeld = context.referencePrice();
        BigDecimal held = adding && markForHeld != null ? position.notional(markForHeld) : BigDecimal.ZERO;

        // Headroom must be strictly positive for any size to be admissible
        checkHeadroom(violations, held, limits.getLeverageCapNotional(),
                "LEVERAGE_CAP_REACHED", InvariantKind.EFFECTIVE_LEVERAGE);
        checkHeadroom(violations, held, limits.getSymbolExposureCapNotional(),
                "SYMBOL_EXPOSURE_CAP_REACHED", InvariantKind.SYMBOL_EXPOSURE);
        checkHeadroom(violations, held, limits.getAccountHeadroomNotional(),
                "ACCOUNT_EXPOSURE_CAP_REACHED", InvariantKind.ACCOUNT_EXPOSURE);
        if (limits.getGroupHeadroomNotional() != null) {
            checkHeadroom(violations, held, limits.getGroupHeadroomNotional(),
                    "CORRELATION_EXPOSURE_CAP_REACHED", InvariantKind.CORRELATION_EXPOSURE);
        }
        checkHeadroom(violations, held, limits.getLiquidationSafeNotional(),
                "LIQUIDATION_BUFFER_REACHED", InvariantKind.LIQUIDATION_BUFFER);

        if (adding && position.riskAtStop().compareTo(limits.getRiskBudget()) >= 0) {
            violations.add(RiskViolation.of(
                    "RISK_BUDGET_EXHAUSTED",
                    InvariantKind.RISK_PER_TRADE,
                    "Loss at stop " + position.riskAtStop() + " already uses the budget " + limits.getRiskBudget()));
        }
        return violations;
    }

    private static void checkHeadroom(
            List<RiskViolation> violations, BigDecimal held, BigDecimal cap, String code, InvariantKind kind) {
        if (held.compareTo(cap) >= 0) {
            violations.add(RiskViolation.of(code, kind, "Notional " + held + " leaves no room under " + cap));
        }
    }

    // ---- REDUCE ----

    private List<RiskViolation> checkReduction(RiskContext context, Mandate mandate, PositionAssessment assessment) {
        Position position = context.getPosition();

        if (!position.hasExposure()) {
            return List.of(RiskViolation.of(
                    "NOTHING_TO_REDUCE",
                    InvariantKind.REDUCTION_USEFULNESS,
                    "No exposure on " + position.getSymbol()));
        }
        if (mandate.getDirection().isDirectional() && mandate.getDirection() != position.getDirection()) {
            return List.of(RiskViolation.of(
                    "DIRECTION_MISMATCH",
                    InvariantKind.DIRECTION,
                    "REDUCE " + mandate.getDirection() + " against open " + position.getDirection() + " position"));
        }

        BigDecimal scope = mandate.getScopeFraction();
        if (scope == null) {
            // Unscoped reductions are sized by the constructor to the minimum that restores the caps
            if (!assessment.isForced()) {
                return List.of(RiskViolation.of(
                        "REDUCE_NOT_IMPROVING",
                        InvariantKind.REDUCTION_USEFULNESS,
                        "No invariant at risk and no reduction scope requested"));
            }
            return List.of();
        }
        if (scope.signum() <= 0 || scope.compareTo(BigDecimal.ONE) > 0) {
            return List.of(RiskViolation.of(
                    "REDUCE_SCOPE_INVALID",
                    InvariantKind.REDUCTION_USEFULNESS,
                    "Reduction scope " + scope + " outside (0, 1]"));
        }

        BigDecimal price = context.referencePrice();
        if (price == null) {
            return List.of(RiskViolation.of(
                    "PRICE_UNAVAILABLE", InvariantKind.PRICE, "No usable price for " + position.getSymbol()));
        }

        BigDecimal remaining = position.getSize().subtract(mandate.requestedReduction(position));
        Position reduced = position.toBuilder().size(remaining.max(BigDecimal.ZERO)).build();

        AccountSnapshot account = context.getAccount();
        RiskEnvelope envelope = context.getEnvelope();
        PositionMetrics before = assessment.getMetrics() != null
                ? assessment.getMetrics()
                : riskCalculator.measure(position, price, account, envelope, context.getFacts());
        PositionMetrics after = riskCalculator.project(reduced, price, account, envelope, context.getFacts());

        if (!improves(before, after)) {
            return List.of(RiskViolation.of(
                    "REDUCE_NOT_IMPROVING",
                    InvariantKind.REDUCTION_USEFULNESS,
                    "Reducing to " + reduced.getSize() + " improves neither leverage, exposure nor liquidation distance"));
        }
        return List.of();
    }

    private static boolean improves(PositionMetrics before, PositionMetrics after) {
        return after.getEffectiveLeverage().compareTo(before.getEffectiveLeverage()) < 0
                || after.getAccountExposure().compareTo(before.getAccountExposure()) < 0
                || after.getLiquidationDistance().compareTo(before.getLiquidationDistance()) > 0;
    }

    // ---- Helpers ----

    private static List<RiskViolation> capViolations(PositionMetrics metrics, RiskEnvelope envelope) {
        List<RiskViolation> violations = new ArrayList<>();

        if (metrics.getEffectiveLeverage().compareTo(envelope.getMaxEffectiveLeverage()) > 0) {
            violations.add(RiskViolation.of(
                    "LEVERAGE_CAP_EXCEEDED",
                    InvariantKind.EFFECTIVE_LEVERAGE,
                    "Effective leverage " + metrics.getEffectiveLeverage() + " above " + envelope.getMaxEffectiveLeverage()));
        }
        if (metrics.getSymbolExposure().compareTo(envelope.getMaxSymbolExposure()) > 0) {
            violations.add(RiskViolation.of(
                    "SYMBOL_EXPOSURE_EXCEEDED",
                    InvariantKind.SYMBOL_EXPOSURE,
                    "Symbol exposure " + metrics.getSymbolExposure() + " above " + envelope.getMaxSymbolExposure()));
        }
        if (metrics.getAccountExposure().compareTo(envelope.getMaxAccountExposure()) > 0) {
            violations.add(RiskViolation.of(
                    "ACCOUNT_EXPOSURE_EXCEEDED",
                    InvariantKind.ACCOUNT_EXPOSURE,
                    "Account exposure " + metrics.getAccountExposure() + " above " + envelope.getMaxAccountExposure()));
        }
        for (CorrelationGroup group : envelope.getCorrelationGroups()) {
            BigDecimal exposure = metrics.getGroupExposures().get(group.getName());
            if (exposure != null && exposure.compareTo(group.getMaxExposure()) > 0) {
                violations.add(RiskViolation.of(
                        "CORRELATION_EXPOSURE_EXCEEDED",
                        InvariantKind.CORRELATION_EXPOSURE,
                        "Group " + group.getName() + " exposure " + exposure + " above " + group.getMaxExposure()));
            }
        }
        if (metrics.getRiskAtStop().compareTo(metrics.getRiskBudget()) > 0) {
            violations.add(RiskViolation.of(
                    "RISK_PER_TRADE_EXCEEDED",
                    InvariantKind.RISK_PER_TRADE,
                    "Loss at stop " + metrics.getRiskAtStop() + " above budget " + metrics.getRiskBudget()));
        }
        return violations;
    }

    private static boolean isAssessable(Position position) {
        return position.hasExposure()
                && (position.getState() == PositionState.OPEN || position.getState() == PositionState.REDUCING);
    }
}
