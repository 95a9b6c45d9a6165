package com.flagship.debt_payoff.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID of the API request handled by the current thread.
 *
 * The ID lives in MDC under {@value #CORRELATION_ID_MDC_KEY} for the duration of
 * the request, so every log line and every error body can carry it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private static final int GENERATED_ID_LENGTH = 8;

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Keeps the caller's ID when one was sent, otherwise generates a short one.
     */
    static String resolve(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        return UUID.randomUUID().toString().substring(0, GENERATED_ID_LENGTH);
    }

    /**
     * @return the current request's correlation ID, or {@code null} outside a request
     */
    public static String current() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }
}
