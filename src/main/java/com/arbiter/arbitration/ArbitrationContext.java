package com.arbiter.arbitration;

import com.arbiter.risk.RiskContext;
import lombok.Builder;
import lombok.Value;

/** Everything arbitration reads for one symbol in one cycle. Immutable. */
@Value
@Builder(toBuilder = true)
public class ArbitrationContext {

    RiskContext risk;

    /** False when the symbol's observation failed the integrity checks this cycle. */
    @Builder.Default
    boolean dataIntact = true;

    /** Halt state read once at cycle start. */
    boolean haltActive;

    public String getSymbol() {
        return risk.getSymbol();
    }

    public long getCycleId() {
        return risk.getCycleId();
    }
}
