package com.staybook.common.exception;

import lombok.Getter;

/**
 * A collaborator the engine depends on (payment gateway, idempotency store) is temporarily
 * unreachable. The caller may retry the same command with the same idempotency key.
 * Mapped to HTTP 503.
 */
@Getter
public class ServiceUnavailableException extends RuntimeException {
    public static final String DEFAULT_CODE = "SERVICE_UNAVAILABLE";

    private final String errorCode;

    public ServiceUnavailableException(String message) {
        this(message, null, DEFAULT_CODE);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        this(message, cause, DEFAULT_CODE);
    }

    protected ServiceUnavailableException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
