package com.arbiter.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Upper bounds on a symbol's notional and loss at stop implied by the envelope and the
 * portfolio facts. Every invariant is monotone in size, so the tightest bound satisfies
 * all of them at once.
 */
@Value
@Builder
public class SizeLimits {

    BigDecimal leverageCapNotional;

    BigDecimal symbolExposureCapNotional;

    /** Account exposure cap minus other symbols' notional. May be negative. */
    BigDecimal accountHeadroomNotional;

    /** Tightest correlation group headroom; null when the symbol is in no group. */
    BigDecimal groupHeadroomNotional;

    BigDecimal liquidationSafeNotional;

    BigDecimal riskBudget;

    /** Tightest exposure-type bound (leverage, symbol, account, group). */
    public BigDecimal exposureCapNotional() {
        BigDecimal cap = leverageCapNotional.min(symbolExposureCapNotional).min(accountHeadroomNotional);
        return groupHeadroomNotional != null ? cap.min(groupHeadroomNotional) : cap;
    }

    /** Tightest notional bound of all, liquidation buffer included. */
    public BigDecimal maxNotional() {
        return exposureCapNotional().min(liquidationSafeNotional);
    }
}
