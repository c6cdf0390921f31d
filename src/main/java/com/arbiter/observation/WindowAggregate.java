package com.arbiter.observation;

import com.arbiter.risk.RiskCalculator;
import java.math.BigDecimal;
import lombok.Value;

/** Count, sum and mean of one primitive over the last {@code window} observations of a symbol. */
@Value
public class WindowAggregate {

    String primitive;

    /** Observations actually inspected; below the requested window while the buffer fills. */
    int window;

    /** Observations that carried the primitive. */
    long count;

    BigDecimal sum;

    /** Null when no observation in the window carried the primitive. */
    public BigDecimal mean() {
        return count == 0 ? null : sum.divide(BigDecimal.valueOf(count), RiskCalculator.MC);
    }
}
