package com.arbiter.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the engine. Recoverable conditions resolve locally to NO_ACTION or a
 * forced safe mandate; terminal ones stop the affected position or the whole engine until
 * an operator intervenes.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    ILLEGAL_TRANSITION("ILLEGAL_TRANSITION", true),
    DATA_INTEGRITY_FAILURE("DATA_INTEGRITY_FAILURE", false),
    MALFORMED_MANDATE("MALFORMED_MANDATE", false),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", true);

    private final String code;
    private final boolean terminal;
}
