package com.arbiter.risk;

import com.arbiter.domain.enums.Direction;
import java.math.BigDecimal;

/** Stop placement rules: a stop sits on the loss side of the price and only ever tightens. */
public final class StopRules {

    private StopRules() {}

    /** True when {@code stop} is strictly on the loss side of {@code price} for {@code direction}. */
    public static boolean isProtective(Direction direction, BigDecimal stop, BigDecimal price) {
        if (stop == null || price == null) {
            return false;
        }
        return switch (direction) {
            case LONG -> stop.compareTo(price) < 0;
            case SHORT -> stop.compareTo(price) > 0;
            case NONE -> false;
        };
    }

    /**
     * The tighter of two stops (closer to the price): the higher one for LONG, the lower one for SHORT.
     * A null stop is ignored.
     */
    public static BigDecimal tighter(Direction direction, BigDecimal current, BigDecimal proposed) {
        if (current == null) {
            return proposed;
        }
        if (proposed == null) {
            return current;
        }
        return switch (direction) {
            case LONG -> current.max(proposed);
            case SHORT -> current.min(proposed);
            case NONE -> current;
        };
    }
}
