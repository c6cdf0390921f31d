package com.arbiter.risk;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Cross-symbol facts computed once before per-symbol evaluation starts.
 *
 * <p>Per-symbol pipelines read these numbers instead of querying other symbols, so symbols
 * can be evaluated independently and in parallel. Notionals are unsigned (size × mark).
 */
@Value
@Builder
public class PortfolioFacts {

    @Builder.Default
    BigDecimal totalNotional = BigDecimal.ZERO;

    @Singular("symbolNotional")
    Map<String, BigDecimal> notionalBySymbol;

    @Singular("groupNotional")
    Map<String, BigDecimal> notionalByGroup;

    /** Total notional is at or above the account exposure cap: every risk increase is pre-denied. */
    boolean accountCapReached;

    /** Symbols in a correlation group at or above its cap. */
    @Singular("deniedSymbol")
    Set<String> deniedSymbols;

    /** Total or group exposure above a hard ceiling. Latches the halt. */
    boolean hardCeilingBreached;

    String breachDetail;

    public static PortfolioFacts empty() {
        return PortfolioFacts.builder().build();
    }

    public BigDecimal notionalOf(String symbol) {
        return notionalBySymbol.getOrDefault(symbol, BigDecimal.ZERO);
    }

    /** Notional held in every symbol except {@code symbol}. */
    public BigDecimal otherNotional(String symbol) {
        return totalNotional.subtract(notionalOf(symbol));
    }

    /** Notional held in {@code group} by symbols other than {@code symbol}. */
    public BigDecimal groupOtherNotional(CorrelationGroup group, String symbol) {
        BigDecimal groupTotal = notionalByGroup.getOrDefault(group.getName(), BigDecimal.ZERO);
        return group.contains(symbol) ? groupTotal.subtract(notionalOf(symbol)) : groupTotal;
    }

    public boolean isRiskIncreaseDenied(String symbol) {
        return accountCapReached || deniedSymbols.contains(symbol);
    }
}
