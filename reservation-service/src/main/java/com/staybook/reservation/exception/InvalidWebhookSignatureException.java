package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;

/**
 * A payment webhook whose signature is missing, stale or does not match the shared secret.
 */
public class InvalidWebhookSignatureException extends BusinessException {
    public static final String CODE = "INVALID_WEBHOOK_SIGNATURE";

    public InvalidWebhookSignatureException(String message) {
        super(message, CODE);
    }
}
