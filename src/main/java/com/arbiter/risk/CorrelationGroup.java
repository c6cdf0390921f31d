package com.arbiter.risk;

import java.math.BigDecimal;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Symbols whose exposure is capped together.
 *
 * <p>{@code maxExposure} is a multiple of equity; risk-increasing mandates are denied once the
 * group's notional reaches it and open positions in the group are forced to reduce above it.
 * {@code hardCeiling}, when set, is the multiple above which the whole engine halts.
 */
@Value
@Builder
public class CorrelationGroup {

    String name;

    @Singular
    Set<String> symbols;

    BigDecimal maxExposure;

    BigDecimal hardCeiling;

    public boolean contains(String symbol) {
        return symbols.contains(symbol);
    }
}
