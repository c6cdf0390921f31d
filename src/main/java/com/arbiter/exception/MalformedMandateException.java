package com.arbiter.exception;

import java.util.Map;

public class MalformedMandateException extends BaseException {

    public MalformedMandateException(String triggerId, String message) {
        super(ErrorCode.MALFORMED_MANDATE, message, Map.of("triggerId", triggerId != null ? triggerId : "N/A"));
    }
}
