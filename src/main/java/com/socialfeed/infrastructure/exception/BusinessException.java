package com.socialfeed.infrastructure.exception;

/**
 * Unchecked failure carrying a stable error code, for lookups that cannot return a Result.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
