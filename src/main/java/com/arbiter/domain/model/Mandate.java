package com.arbiter.domain.model;

import com.arbiter.domain.enums.Direction;
import com.arbiter.domain.enums.MandateOrigin;
import com.arbiter.domain.enums.MandateType;
import com.arbiter.domain.enums.PositionState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A typed, single-cycle permission proposal for one action class on one symbol.
 *
 * <p>Mandates are never persisted or merged across cycles. {@code triggerId} identifies a
 * mandate in the audit trail and is the final ordering key during arbitration, so it must
 * be unique within a symbol's cycle.
 *
 * <p>Optional fields by type:
 * <ul>
 *   <li>ENTER: {@code direction} and {@code stopPrice} required, {@code limitPrice} optional</li>
 *   <li>ADD: {@code direction} must match the open position; {@code stopPrice} may tighten it</li>
 *   <li>REDUCE: {@code scopeFraction} in (0, 1] is the requested share of the current size</li>
 *   <li>EXIT, HOLD, BLOCK: no sizing fields</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class Mandate {

    String triggerId;

    MandateType type;

    String symbol;

    @Builder.Default
    Direction direction = Direction.NONE;

    @Builder.Default
    MandateOrigin origin = MandateOrigin.STRATEGY;

    /** Lifecycle states the generator considers this mandate valid in. Empty = no extra restriction. */
    @Singular
    Set<PositionState> preconditions;

    BigDecimal scopeFraction;

    BigDecimal stopPrice;

    BigDecimal limitPrice;

    /** Last cycle id this mandate may be arbitrated in. Null = current cycle only, never carried. */
    Long expiresAfterCycle;

    @JsonIgnore
    public int getAuthorityRank() {
        return type.getAuthority();
    }

    public boolean admitsState(PositionState state) {
        return preconditions.isEmpty() || preconditions.contains(state);
    }

    public boolean isExpiredAt(long cycleId) {
        return expiresAfterCycle != null && expiresAfterCycle < cycleId;
    }

    /** Requested reduction quantity for REDUCE mandates; zero for anything else. */
    public BigDecimal requestedReduction(Position position) {
        if (type != MandateType.REDUCE || scopeFraction == null) {
            return BigDecimal.ZERO;
        }
        return position.getSize().multiply(scopeFraction);
    }
}
