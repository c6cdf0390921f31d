package com.arbiter.exception;

import java.util.Map;

/** Thrown at the observation boundary when a snapshot cannot be read at all. */
public class DataIntegrityException extends BaseException {

    public DataIntegrityException(String message) {
        super(ErrorCode.DATA_INTEGRITY_FAILURE, message);
    }

    public DataIntegrityException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_INTEGRITY_FAILURE, message, details);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(ErrorCode.DATA_INTEGRITY_FAILURE, message, cause);
    }
}
