package com.arbiter.domain.enums;

/**
 * Confirmed execution results reported back by the execution adapter.
 * Only these drive lifecycle transitions; mandate intent and elapsed time never do.
 */
public enum ExecutionReportType {

    /** Entry order accepted by the venue: FLAT → ENTERING. */
    ENTRY_ACKNOWLEDGED,

    /** Entry filled: ENTERING → OPEN. */
    ENTRY_FILLED,

    /** Entry cancelled with nothing filled: ENTERING → CLOSED → FLAT. */
    ENTRY_ABORTED,

    /** Add filled on an OPEN position: size grows, state unchanged. */
    ADD_FILLED,

    /** Reduce order accepted: OPEN → REDUCING. */
    REDUCE_ACKNOWLEDGED,

    /** Reduce filled: REDUCING → OPEN, or through CLOSING/CLOSED to FLAT when nothing remains. */
    REDUCE_FILLED,

    /** Exit order accepted: OPEN/REDUCING/FAILED → CLOSING. */
    EXIT_ACKNOWLEDGED,

    /** Exit filled: CLOSING → CLOSED → FLAT. */
    EXIT_FILLED,

    /** Venue or adapter failure: any state except CLOSED → FAILED. */
    EXECUTION_FAILED
}
