package com.arbiter.domain.enums;

/** Order-level action handed to the execution adapter. ENTER and ADD both map to OPEN. */
public enum ExecutionAction {
    OPEN,
    REDUCE,
    CLOSE
}
