package com.arbiter.observation;

import com.arbiter.domain.enums.IntegrityIssue;
import java.util.List;
import lombok.Value;

/** Outcome of the integrity checks for one symbol's observation in one cycle. */
@Value
public class IntegrityReport {

    String symbol;

    List<IntegrityIssue> issues;

    /** One line per issue, same order as {@link #issues}. */
    List<String> details;

    public static IntegrityReport intact(String symbol) {
        return new IntegrityReport(symbol, List.of(), List.of());
    }

    public boolean isIntact() {
        return issues.isEmpty();
    }
}
