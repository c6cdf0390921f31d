package com.arbiter.risk;

import com.arbiter.domain.enums.VerdictType;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Mandate-independent verdict on the position as it stands: ALLOW, FORCE_REDUCE or FORCE_EXIT.
 * A FORCE outcome is injected as a synthetic mandate every cycle it persists.
 */
@Value
@Builder
public class PositionAssessment {

    @Builder.Default
    VerdictType forced = VerdictType.ALLOW;

    /** Null for positions without exposure or when equity is not positive. */
    PositionMetrics metrics;

    @Singular
    List<RiskViolation> violations;

    public boolean isForced() {
        return forced.isForce();
    }

    public static PositionAssessment clear() {
        return PositionAssessment.builder().build();
    }
}
