package com.flagship.debt_payoff.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body of every failed planner request.
 *
 * For engine failures {@code error} is the error code, e.g. {@code INSUFFICIENT_BUDGET};
 * {@code details} maps request fields to validation messages.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    String correlationId;
    Instant timestamp;
}
