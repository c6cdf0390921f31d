package com.arbiter.domain.model;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.PositionState;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-symbol position snapshot.
 *
 * <p>At most one position exists per symbol. Direction is fixed while the position is
 * not FLAT, and size only grows through confirmed ENTRY/ADD fills. A new instance is
 * produced for every confirmed lifecycle transition by
 * {@link com.arbiter.lifecycle.PositionStateMachine}; nothing mutates an instance in place.
 *
 * <p>While ENTERING, {@code size} is the requested entry quantity; from OPEN onwards it is
 * the filled quantity. Size is always unsigned; the side is carried by {@code direction}.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String symbol;

    @Builder.Default
    Direction direction = Direction.NONE;

    @Builder.Default
    BigDecimal size = BigDecimal.ZERO;

    BigDecimal entryPrice;

    /** Protective stop. Only ever moves towards the mark (tightening). */
    BigDecimal stopPrice;

    @Builder.Default
    PositionState state = PositionState.FLAT;

    /** Loss at stop reserved against the per-trade risk budget: size × |entry − stop|. */
    @Builder.Default
    BigDecimal riskReserved = BigDecimal.ZERO;

    /** Venue-reported liquidation price. Null when the venue does not report one. */
    BigDecimal liquidationPrice;

    public static Position flat(String symbol) {
        return Position.builder().symbol(symbol).build();
    }

    public boolean isFlat() {
        return state == PositionState.FLAT;
    }

    public boolean hasExposure() {
        return size.signum() > 0 && direction.isDirectional();
    }

    public BigDecimal notional(BigDecimal price) {
        return size.multiply(price);
    }

    /** Loss if the stop is hit from the entry price; zero when either price is unknown. */
    public BigDecimal riskAtStop() {
        if (entryPrice == null || stopPrice == null) {
            return BigDecimal.ZERO;
        }
        return size.multiply(entryPrice.subtract(stopPrice).abs());
    }
}
