package com.arbiter.domain.enums;

/** Reasons a symbol's primitive snapshot is not admissible for risk-increasing decisions. */
public enum IntegrityIssue {
    MISSING_SNAPSHOT,
    MISSING_MARK_PRICE,
    MISSING_PRIMITIVE,
    STALE_PRIMITIVES,
    TIMESTAMP_REGRESSION,
    INTERPRETED_LABEL
}
