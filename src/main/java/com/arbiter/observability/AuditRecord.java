package com.arbiter.observability;

import com.arbiter.arbitration.ArbitrationResult;
import com.arbiter.domain.enums.IntegrityIssue;
import com.arbiter.domain.model.ExecutionIntent;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything decided for one symbol in one cycle: the inputs that shaped arbitration (integrity,
 * halt), the full arbitration result and the intent emitted, if any.
 *
 * <p>Contains no wall-clock data beyond the cycle timestamp supplied as input, so replaying the
 * cycle renders the same JSON.
 */
@Value
@Builder
public class AuditRecord {

    long cycleId;

    long cycleTimestampMillis;

    String symbol;

    boolean dataIntact;

    List<IntegrityIssue> integrityIssues;

    boolean haltActive;

    ArbitrationResult arbitration;

    /** Null when the cycle ended in NO_ACTION or a restriction (HOLD/BLOCK). */
    ExecutionIntent intent;
}
