package com.staybook.reservation.exception;

import com.staybook.common.exception.ServiceUnavailableException;

/**
 * Payment gateway could not be reached after bounded retries, or its circuit is open.
 */
public class GatewayUnavailableException extends ServiceUnavailableException {
    public static final String CODE = "GATEWAY_UNAVAILABLE";

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause, CODE);
    }
}
