package com.arbiter.risk;

import com.arbiter.domain.enums.VerdictType;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of evaluating one mandate against the risk invariants.
 *
 * <p>ALLOW carries no violations. DENY and FORCE_* carry every violation found so the audit
 * trail shows the complete picture, not just the first failure.
 */
@Getter
public class InvariantVerdict {

    private final VerdictType type;
    private final List<RiskViolation> violations;

    private InvariantVerdict(VerdictType type, List<RiskViolation> violations) {
        this.type = type;
        this.violations = violations;
    }

    public static InvariantVerdict allow() {
        return new InvariantVerdict(VerdictType.ALLOW, Collections.emptyList());
    }

    public static InvariantVerdict deny(List<RiskViolation> violations) {
        return new InvariantVerdict(VerdictType.DENY, List.copyOf(violations));
    }

    public static InvariantVerdict force(VerdictType type, List<RiskViolation> violations) {
        if (!type.isForce()) {
            throw new IllegalArgumentException("Not a FORCE verdict: " + type);
        }
        return new InvariantVerdict(type, List.copyOf(violations));
    }

    public boolean isAllowed() {
        return type == VerdictType.ALLOW;
    }

    @Override
    public String toString() {
        return violations.isEmpty() ? type.name() : type + " " + violations;
    }
}
