package com.arbiter.core.engine;

import com.arbiter.arbitration.ArbitrationResult;
import com.arbiter.domain.model.ExecutionIntent;
import com.arbiter.observation.IntegrityReport;
import lombok.Value;

/** Outcome of one symbol's pipeline in one cycle. */
@Value
public class SymbolDecision {

    String symbol;

    IntegrityReport integrity;

    ArbitrationResult arbitration;

    /** Null when no intent was emitted. */
    ExecutionIntent intent;

    public boolean hasIntent() {
        return intent != null;
    }
}
