package com.arbiter.domain.model;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.ExecutionAction;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.enums.PriceType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Atomic, fully-specified order instruction for the execution adapter.
 * At most one is emitted per symbol per cycle and it is never modified after emission.
 *
 * <p>A CLOSE for a position still ENTERING is a cancel of the working entry order, sized at the
 * requested entry quantity. The adapter confirms it with {@code ENTRY_ABORTED} when nothing
 * filled, or with {@code ENTRY_FILLED} followed by an exit once a fill raced the cancel. An
 * {@code EXIT_ACKNOWLEDGED} report for an ENTERING position is an illegal transition and fails it.
 */
@Value
@Builder
public class ExecutionIntent {

    long cycleId;

    String symbol;

    ExecutionAction action;

    /** Side of the position the intent acts on (not the order side). */
    Direction direction;

    BigDecimal quantity;

    PriceType priceType;

    /** Set only for LIMIT intents. */
    BigDecimal limitPrice;

    /** Protective stop that must be in force after the intent executes. */
    BigDecimal stopPrice;

    MandateType mandateType;

    String triggerId;
}
