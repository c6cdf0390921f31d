package com.arbiter.domain.enums;

import java.math.BigDecimal;

/**
 * Side of a position or mandate.
 * NONE is only valid for FLAT positions and for mandates that carry no side (HOLD, BLOCK).
 */
public enum Direction {
    LONG,
    SHORT,
    NONE;

    /** +1 for LONG, -1 for SHORT, 0 for NONE. */
    public BigDecimal sign() {
        return switch (this) {
            case LONG -> BigDecimal.ONE;
            case SHORT -> BigDecimal.ONE.negate();
            case NONE -> BigDecimal.ZERO;
        };
    }

    public boolean isDirectional() {
        return this != NONE;
    }
}
