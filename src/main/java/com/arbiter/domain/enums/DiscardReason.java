package com.arbiter.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a mandate was not selected. The code is what appears in the audit trail.
 */
public enum DiscardReason {
    LOWER_AUTHORITY("lower_authority"),
    STATE_INADMISSIBLE("state_inadmissible"),
    INVARIANT_DENIED("invariant_denied"),
    PRECONDITION_UNMET("precondition_unmet"),
    EXPIRED("expired"),
    SYMBOL_MISMATCH("symbol_mismatch"),
    MALFORMED("malformed"),
    DIRECTIONAL_AMBIGUITY("directional_ambiguity"),
    HALT_SUPPRESSED("halt_suppressed"),
    DATA_INTEGRITY("data_integrity"),
    SIZING_INFEASIBLE("sizing_infeasible");

    private final String code;

    DiscardReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
