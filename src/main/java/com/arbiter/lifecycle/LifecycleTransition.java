package com.arbiter.lifecycle;

import com.arbiter.domain.enums.ExecutionReportType;
import com.arbiter.domain.enums.PositionState;
import lombok.Value;

/** One confirmed edge of the lifecycle graph, caused by an execution report. */
@Value
public class LifecycleTransition {

    String symbol;
    PositionState from;
    PositionState to;

    /** Report that caused the edge; null when an operator resolved the position. */
    ExecutionReportType cause;

    @Override
    public String toString() {
        return symbol + " " + from + "->" + to + " (" + (cause != null ? cause : "operator") + ")";
    }
}
