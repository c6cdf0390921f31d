package com.arbiter.risk;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.model.AccountSnapshot;
import com.arbiter.domain.model.Position;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Pure risk arithmetic shared by the invariant evaluator and the intent constructor.
 *
 * <p>Liquidation mechanics (mark-based projection):
 * <ul>
 *   <li>LONG: {@code liq = mark × (1 − 1/L + mmr)}</li>
 *   <li>SHORT: {@code liq = mark × (1 + 1/L − mmr)}</li>
 *   <li>distance: {@code |mark − liq| / mark}, zero once the mark has crossed the liquidation price</li>
 * </ul>
 * where L is the symbol's effective leverage (notional / equity), never an input.
 *
 * <p>A venue-reported liquidation price on the position takes precedence for the current
 * distance. Projections of hypothetical positions always use the model.
 */
@Component
public class RiskCalculator {

    public static final MathContext MC = MathContext.DECIMAL64;

    /** Distance reported for positions without exposure (the price would have to reach zero). */
    private static final BigDecimal FULL_DISTANCE = BigDecimal.ONE;

    /** Metrics of the position as it stands, venue liquidation price included. */
    public PositionMetrics measure(
            Position position, BigDecimal markPrice, AccountSnapshot account, RiskEnvelope envelope, PortfolioFacts facts) {
        return compute(position, markPrice, account, envelope, facts, true);
    }

    /** Metrics of a hypothetical position, liquidation from the model only. */
    public PositionMetrics project(
            Position position, BigDecimal markPrice, AccountSnapshot account, RiskEnvelope envelope, PortfolioFacts facts) {
        return compute(position, markPrice, account, envelope, facts, false);
    }

    private PositionMetrics compute(
            Position position,
            BigDecimal markPrice,
            AccountSnapshot account,
            RiskEnvelope envelope,
            PortfolioFacts facts,
            boolean useReportedLiquidation) {
        BigDecimal equity = requireSolvent(account);
        String symbol = position.getSymbol();
        BigDecimal notional = position.notional(markPrice);
        BigDecimal leverage = leverage(notional, equity);

        BigDecimal liquidationPrice = null;
        BigDecimal liquidationDistance = FULL_DISTANCE;
        if (position.hasExposure()) {
            liquidationPrice = useReportedLiquidation && position.getLiquidationPrice() != null
                    ? position.getLiquidationPrice()
                    : modelLiquidationPrice(
                            position.getDirection(), markPrice, leverage, envelope.getMaintenanceMarginRate());
            liquidationDistance = liquidationDistance(position.getDirection(), markPrice, liquidationPrice);
        }

        PositionMetrics.PositionMetricsBuilder builder = PositionMetrics.builder()
                .notional(notional)
                .effectiveLeverage(leverage)
                .liquidationPrice(liquidationPrice)
                .liquidationDistance(liquidationDistance)
                .symbolExposure(leverage)
                .accountExposure(facts.otherNotional(symbol).add(notional).divide(equity, MC))
                .riskAtStop(position.riskAtStop())
                .riskBudget(riskBudget(equity, envelope));

        for (CorrelationGroup group : envelope.groupsOf(symbol)) {
            BigDecimal groupNotional = facts.groupOtherNotional(group, symbol).add(notional);
            builder.groupExposure(group.getName(), groupNotional.divide(equity, MC));
        }
        return builder.build();
    }

    /** Caps on this symbol's notional and loss at stop, given everything else held. */
    public SizeLimits sizeLimits(String symbol, AccountSnapshot account, RiskEnvelope envelope, PortfolioFacts facts) {
        BigDecimal equity = requireSolvent(account);

        BigDecimal groupHeadroom = null;
        for (CorrelationGroup group : envelope.groupsOf(symbol)) {
            BigDecimal headroom =
                    group.getMaxExposure().multiply(equity).subtract(facts.groupOtherNotional(group, symbol));
            groupHeadroom = groupHeadroom == null ? headroom : groupHeadroom.min(headroom);
        }

        return SizeLimits.builder()
                .leverageCapNotional(envelope.getMaxEffectiveLeverage().multiply(equity))
                .symbolExposureCapNotional(envelope.getMaxSymbolExposure().multiply(equity))
                .accountHeadroomNotional(
                        envelope.getMaxAccountExposure().multiply(equity).subtract(facts.otherNotional(symbol)))
                .groupHeadroomNotional(groupHeadroom)
                .liquidationSafeNotional(maxNotionalForBuffer(equity, envelope))
                .riskBudget(riskBudget(equity, envelope))
                .build();
    }

    public BigDecimal leverage(BigDecimal notional, BigDecimal equity) {
        return notional.divide(equity, MC);
    }

    public BigDecimal riskBudget(BigDecimal equity, RiskEnvelope envelope) {
        return equity.multiply(envelope.getMaxRiskPerTrade());
    }

    /**
     * Largest notional whose model liquidation distance still meets the buffer:
     * {@code 1/L − mmr ≥ buffer  ⇔  notional ≤ equity / (buffer + mmr)}.
     */
    public BigDecimal maxNotionalForBuffer(BigDecimal equity, RiskEnvelope envelope) {
        return equity.divide(envelope.getMinLiquidationBuffer().add(envelope.getMaintenanceMarginRate()), MC);
    }

    public BigDecimal modelLiquidationPrice(
            Direction direction, BigDecimal markPrice, BigDecimal leverage, BigDecimal maintenanceMarginRate) {
        if (leverage.signum() <= 0) {
            throw new IllegalArgumentException("Leverage must be positive: " + leverage);
        }
        BigDecimal inverse = BigDecimal.ONE.divide(leverage, MC);
        return switch (direction) {
            case LONG -> markPrice.multiply(BigDecimal.ONE.subtract(inverse).add(maintenanceMarginRate), MC);
            case SHORT -> markPrice.multiply(BigDecimal.ONE.add(inverse).subtract(maintenanceMarginRate), MC);
            case NONE -> throw new IllegalArgumentException("No liquidation price without a direction");
        };
    }

    /** {@code |mark − liq| / mark}, zero when the mark is at or beyond the liquidation price. */
    public BigDecimal liquidationDistance(Direction direction, BigDecimal markPrice, BigDecimal liquidationPrice) {
        if (markPrice.signum() <= 0) {
            throw new IllegalArgumentException("Mark price must be positive: " + markPrice);
        }
        boolean crossed = switch (direction) {
            case LONG -> markPrice.compareTo(liquidationPrice) <= 0;
            case SHORT -> markPrice.compareTo(liquidationPrice) >= 0;
            case NONE -> false;
        };
        if (crossed) {
            return BigDecimal.ZERO;
        }
        return markPrice.subtract(liquidationPrice).abs().divide(markPrice, MC);
    }

    /** Rounds a quantity down to the envelope's step. Never negative. */
    public BigDecimal floorToStep(BigDecimal quantity, RiskEnvelope envelope) {
        if (quantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal steps = quantity.divide(envelope.getQuantityStep(), 0, RoundingMode.DOWN);
        return steps.multiply(envelope.getQuantityStep());
    }

    /** Rounds a quantity up to the envelope's step. Never negative. */
    public BigDecimal ceilToStep(BigDecimal quantity, RiskEnvelope envelope) {
        if (quantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal steps = quantity.divide(envelope.getQuantityStep(), 0, RoundingMode.UP);
        return steps.multiply(envelope.getQuantityStep());
    }

    private static BigDecimal requireSolvent(AccountSnapshot account) {
        if (!account.isSolvent()) {
            throw new IllegalArgumentException("Risk metrics are undefined for equity " + account.getEquity());
        }
        return account.getEquity();
    }
}
