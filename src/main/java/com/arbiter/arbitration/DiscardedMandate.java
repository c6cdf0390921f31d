package com.arbiter.arbitration;

import com.arbiter.domain.enums.DiscardReason;
import com.arbiter.domain.model.Mandate;
import com.arbiter.risk.RiskViolation;
import java.util.List;
import lombok.Value;

/** A mandate that was not selected, with the reason and any invariant violations behind it. */
@Value
public class DiscardedMandate {

    Mandate mandate;

    DiscardReason reason;

    List<RiskViolation> violations;

    /** Contract breach for MALFORMED, null otherwise. */
    String detail;

    public static DiscardedMandate of(Mandate mandate, DiscardReason reason) {
        return new DiscardedMandate(mandate, reason, List.of(), null);
    }

    public static DiscardedMandate denied(Mandate mandate, List<RiskViolation> violations) {
        return new DiscardedMandate(mandate, DiscardReason.INVARIANT_DENIED, List.copyOf(violations), null);
    }

    public static DiscardedMandate malformed(Mandate mandate, String detail) {
        return new DiscardedMandate(mandate, DiscardReason.MALFORMED, List.of(), detail);
    }
}
