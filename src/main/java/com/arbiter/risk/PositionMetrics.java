package com.arbiter.risk;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Risk facts derived for one position (actual or projected). Exposures are multiples of equity. */
@Value
@Builder
public class PositionMetrics {

    BigDecimal notional;

    BigDecimal effectiveLeverage;

    /** Null when the position carries no exposure. */
    BigDecimal liquidationPrice;

    BigDecimal liquidationDistance;

    BigDecimal symbolExposure;

    BigDecimal accountExposure;

    @Singular
    Map<String, BigDecimal> groupExposures;

    BigDecimal riskAtStop;

    BigDecimal riskBudget;
}
