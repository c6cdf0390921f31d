package com.arbiter.risk;

import com.arbiter.exception.InvalidConfigurationException;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Risk caps for a session. Loaded once at startup and never modified.
 *
 * <p>Organized into three tiers:
 * <ul>
 *   <li><b>Per-trade:</b> loss at stop as a fraction of equity</li>
 *   <li><b>Per-symbol:</b> effective leverage, symbol exposure, liquidation buffer</li>
 *   <li><b>Portfolio:</b> account exposure, correlation groups, hard ceiling (halt)</li>
 * </ul>
 *
 * <p>Exposures and leverage are multiples of equity (notional / equity). The liquidation
 * buffer and maintenance margin rate are fractions of the mark price.
 */
@Value
@Builder
public class RiskEnvelope {

    /** Maximum loss at stop per position as a fraction of equity (0.01 = 1%). */
    BigDecimal maxRiskPerTrade;

    /** Maximum total notional across all symbols as a multiple of equity. */
    BigDecimal maxAccountExposure;

    /** Maximum notional of one symbol as a multiple of equity. */
    BigDecimal maxSymbolExposure;

    /** Minimum distance to liquidation as a fraction of mark (0.10 = 10%). */
    BigDecimal minLiquidationBuffer;

    /** Maximum per-symbol effective leverage (symbol notional / equity). */
    BigDecimal maxEffectiveLeverage;

    @Singular
    List<CorrelationGroup> correlationGroups;

    /** Venue maintenance margin rate used by the liquidation model. */
    BigDecimal maintenanceMarginRate;

    /** Total notional multiple above which the engine halts. */
    BigDecimal hardExposureCeiling;

    /** Smallest tradable quantity increment. */
    BigDecimal quantityStep;

    public List<CorrelationGroup> groupsOf(String symbol) {
        return correlationGroups.stream().filter(g -> g.contains(symbol)).collect(Collectors.toList());
    }

    /**
     * Checks the caps are positive and mutually consistent.
     *
     * @throws InvalidConfigurationException on the first inconsistency found
     */
    public RiskEnvelope validate() {
        requirePositive("maxRiskPerTrade", maxRiskPerTrade);
        requirePositive("maxAccountExposure", maxAccountExposure);
        requirePositive("maxSymbolExposure", maxSymbolExposure);
        requirePositive("minLiquidationBuffer", minLiquidationBuffer);
        requirePositive("maxEffectiveLeverage", maxEffectiveLeverage);
        requirePositive("hardExposureCeiling", hardExposureCeiling);
        requirePositive("quantityStep", quantityStep);
        if (maintenanceMarginRate == null || maintenanceMarginRate.signum() < 0) {
            throw new InvalidConfigurationException("maintenanceMarginRate must be >= 0");
        }
        if (maxRiskPerTrade.compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidConfigurationException("maxRiskPerTrade must be a fraction below 1: " + maxRiskPerTrade);
        }
        if (minLiquidationBuffer.add(maintenanceMarginRate).compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidConfigurationException(
                    "minLiquidationBuffer + maintenanceMarginRate must stay below 1, no leverage could satisfy it");
        }
        if (hardExposureCeiling.compareTo(maxAccountExposure) < 0) {
            throw new InvalidConfigurationException("hardExposureCeiling " + hardExposureCeiling
                    + " is below maxAccountExposure " + maxAccountExposure);
        }
        Set<String> names = new HashSet<>();
        for (CorrelationGroup group : correlationGroups) {
            if (group.getName() == null || !names.add(group.getName())) {
                throw new InvalidConfigurationException("Correlation group names must be present and unique");
            }
            requirePositive("correlationGroups[" + group.getName() + "].maxExposure", group.getMaxExposure());
            if (group.getHardCeiling() != null && group.getHardCeiling().compareTo(group.getMaxExposure()) < 0) {
                throw new InvalidConfigurationException(
                        "Hard ceiling of group " + group.getName() + " is below its max exposure");
            }
        }
        return this;
    }

    private static void requirePositive(String name, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidConfigurationException(name + " must be > 0, was " + value);
        }
    }
}
