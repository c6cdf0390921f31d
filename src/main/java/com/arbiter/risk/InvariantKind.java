package com.arbiter.risk;

/** The hard constraint a {@link RiskViolation} refers to. */
public enum InvariantKind {
    EQUITY,
    PRICE,
    LIFECYCLE,
    DIRECTION,
    STOP,
    AVERAGING_DOWN,
    RISK_PER_TRADE,
    EFFECTIVE_LEVERAGE,
    LIQUIDATION_BUFFER,
    SYMBOL_EXPOSURE,
    ACCOUNT_EXPOSURE,
    CORRELATION_EXPOSURE,
    REDUCTION_USEFULNESS
}
