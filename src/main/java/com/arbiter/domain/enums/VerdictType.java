package com.arbiter.domain.enums;

/**
 * Outcome of invariant evaluation for one mandate.
 * FORCE_* verdicts deny the evaluated mandate and require the engine to inject the forced action.
 */
public enum VerdictType {
    ALLOW,
    DENY,
    FORCE_REDUCE,
    FORCE_EXIT;

    public boolean isForce() {
        return this == FORCE_REDUCE || this == FORCE_EXIT;
    }

    /** The mandate type injected for a FORCE verdict. */
    public MandateType forcedMandateType() {
        return switch (this) {
            case FORCE_REDUCE -> MandateType.REDUCE;
            case FORCE_EXIT -> MandateType.EXIT;
            case ALLOW, DENY -> throw new IllegalStateException("Verdict " + this + " does not force a mandate");
        };
    }
}
