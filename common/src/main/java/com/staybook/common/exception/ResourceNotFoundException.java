package com.staybook.common.exception;

/**
 * Thrown when a reservation, payment attempt or other addressed record does not exist.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String message) {
        super(message, CODE);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s %s not found", resourceType, identifier), CODE);
    }
}
