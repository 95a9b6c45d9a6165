package com.flagship.debt_payoff.exception;

/**
 * Raised when a debt or override addressed by the caller does not exist.
 * Mapped to HTTP 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
