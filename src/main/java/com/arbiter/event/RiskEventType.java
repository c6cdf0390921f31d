package com.arbiter.event;

/**
 * Classifies the condition that triggered a {@link RiskEvent}.
 *
 * <p>Listeners can filter on event type, e.g. page an operator on HALT_TRIGGERED but
 * only count FORCED_MANDATE.
 */
public enum RiskEventType {

    /** The invariant evaluator forced a REDUCE or EXIT on a position. */
    FORCED_MANDATE,

    /** A symbol's observation failed the integrity checks this cycle. */
    INTEGRITY_FAILURE,

    /** An execution report implied an illegal lifecycle transition; the position is FAILED. */
    ILLEGAL_TRANSITION,

    /** The venue or adapter reported an execution failure; the position is FAILED. */
    EXECUTION_FAILURE,

    /** Halt latched. Only exits are attempted until an operator resets it. */
    HALT_TRIGGERED,

    /** Halt cleared by an operator. */
    HALT_RESET
}
