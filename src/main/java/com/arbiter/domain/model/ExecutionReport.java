package com.arbiter.domain.model;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.ExecutionReportType;
import com.arbiter.domain.enums.MandateType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Confirmed execution result from the execution adapter.
 *
 * <p>The only input that moves a position through its lifecycle or changes account equity.
 * {@code mandateType} names the mandate the originating intent was built from and is checked
 * for admissibility in the position's current state; it is null for EXECUTION_FAILED.
 */
@Value
@Builder
public class ExecutionReport {

    String symbol;

    ExecutionReportType type;

    MandateType mandateType;

    String triggerId;

    Direction direction;

    /** ENTRY_ACKNOWLEDGED: requested quantity. Fills: quantity filled by this report. */
    BigDecimal quantity;

    BigDecimal price;

    BigDecimal stopPrice;

    BigDecimal liquidationPrice;

    @Builder.Default
    BigDecimal realizedPnl = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal fee = BigDecimal.ZERO;

    /** Free-form venue code for EXECUTION_FAILED reports. */
    String detail;
}
