package com.arbiter.exception;

public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }
}
