package com.arbiter.domain.enums;

/**
 * Lifecycle state of a per-symbol position.
 * Transitions: FLAT → ENTERING → OPEN ⇄ REDUCING; OPEN/REDUCING → CLOSING → CLOSED → FLAT;
 * any state except CLOSED → FAILED → CLOSING. ENTERING → CLOSED covers an entry aborted with nothing filled.
 * The legal table and the admissible mandates per state live in
 * {@link com.arbiter.lifecycle.PositionStateMachine}.
 */
public enum PositionState {
    FLAT,
    ENTERING,
    OPEN,
    REDUCING,
    CLOSING,
    CLOSED,
    FAILED
}
