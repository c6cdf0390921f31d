package com.arbiter.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>WARNING is for conditions the engine resolves locally (denials, forced reductions,
 * integrity failures). CRITICAL is for conditions that need an operator: FAILED
 * positions and halts.
 */
public enum RiskLevel {

    /** Informational, no protective action taken. */
    INFO,

    /** Resolved locally by a forced mandate or NO_ACTION. */
    WARNING,

    /** Terminal for a position or the whole engine until reset. */
    CRITICAL
}
