package com.flagship.debt_payoff.exception;

import com.flagship.debt_payoff.observability.CorrelationContext;
import com.flagship.debt_payoff.simulation.SimulationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 * Every error body is an {@link ApiError}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SimulationException.class)
    public ResponseEntity<ApiError> handleSimulationException(SimulationException e) {
        log.warn("Simulation failed: code={}, message={}", e.getCode(), e.getMessage());

        return build(HttpStatus.BAD_REQUEST, e.getCode().name(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableMessage(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());

        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed request body", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());

        return build(HttpStatus.BAD_REQUEST, "Invalid Request", e.getName() + " must be an integer", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        return build(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        log.debug("Resource not found: {}", e.getMessage());

        return build(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    /**
     * Spring MVC request errors (unknown path, wrong method, unsupported media type)
     * keep the status the framework assigned to them.
     */
    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        HttpMediaTypeNotAcceptableException.class,
        MissingServletRequestParameterException.class,
        ErrorResponseException.class
    })
    public ResponseEntity<ApiError> handleRequestError(Exception e) {
        ErrorResponse errorResponse = (ErrorResponse) e;
        HttpStatusCode status = errorResponse.getStatusCode();
        log.warn("Request rejected: status={}, message={}", status.value(), e.getMessage());

        HttpStatus known = HttpStatus.resolve(status.value());
        String error = known != null ? known.getReasonPhrase() : "Request Error";
        String message = errorResponse.getBody().getDetail() != null
            ? errorResponse.getBody().getDetail()
            : e.getMessage();
        return build(status, error, message, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> build(HttpStatusCode status, String error, String message, Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.current())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
