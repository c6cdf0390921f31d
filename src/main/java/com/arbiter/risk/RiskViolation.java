package com.arbiter.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single invariant breach found during evaluation.
 *
 * <p>Each violation has a code (machine-readable), the invariant it refers to and a message
 * carrying the measured value and the cap. Codes follow the pattern LEVERAGE_CAP_EXCEEDED,
 * LIQUIDATION_BUFFER_BREACHED, PORTFOLIO_CAP_REACHED, etc.
 */
@Getter
@Builder
public class RiskViolation {

    /** Machine-readable violation code (e.g., "LEVERAGE_CAP_EXCEEDED"). */
    private final String code;

    private final InvariantKind invariant;

    private final String message;

    public static RiskViolation of(String code, InvariantKind invariant, String message) {
        return RiskViolation.builder().code(code).invariant(invariant).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
