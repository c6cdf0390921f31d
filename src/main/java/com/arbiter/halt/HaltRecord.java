package com.arbiter.halt;

import com.arbiter.domain.enums.HaltCause;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Why and when the halt latched. Kept until an operator resets the halt. */
@Value
@Builder
public class HaltRecord {

    HaltCause cause;

    /** Symbol that caused the halt; null for portfolio-wide and operator halts. */
    String symbol;

    String detail;

    /** Cycle in which the halt latched; -1 when latched outside a cycle (execution report, operator). */
    long cycleId;

    Instant activatedAt;
}
