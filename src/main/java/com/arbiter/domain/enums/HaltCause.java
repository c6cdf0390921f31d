package com.arbiter.domain.enums;

/** Conditions that latch the global halt. */
public enum HaltCause {
    FAILED_POSITION,
    DATA_FEED_INTEGRITY_LOSS,
    CORRELATED_BREACH,
    OPERATOR
}
