package com.staybook.common.exception;

import lombok.Getter;

/**
 * Root of the engine's domain exceptions. Every subtype carries a stable error code
 * that the API layer returns verbatim so clients can branch on it.
 */
@Getter
public class BusinessException extends RuntimeException {
    public static final String DEFAULT_CODE = "BUSINESS_ERROR";

    private final String errorCode;

    public BusinessException(String message) {
        this(message, DEFAULT_CODE);
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
