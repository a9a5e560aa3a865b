package com.batterysmart.swap_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates ledger errors into a uniform JSON body.
 *
 * NotFound maps to 404, InvalidInput and request validation to 400,
 * every Conflict (including lock timeouts) to 409.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.info("Not found: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(Map.of("resource", e.getResource(), "identifier", e.getIdentifier()))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException e) {
        log.warn("Invalid input on {}: {}", e.getField(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(e.getField() != null ? Map.of("field", e.getField()) : null)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(LeaveAllowanceExceededException.class)
    public ResponseEntity<ErrorResponse> handleLeaveAllowance(LeaveAllowanceExceededException e) {
        log.warn("Leave allowance exceeded: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("month", e.getMonthKey());
        details.put("requested", String.valueOf(e.getRequested()));
        details.put("remaining", String.valueOf(e.getRemaining()));

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e) {
        log.warn("Conflict: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(Map.of("retryable", String.valueOf(e.isRetryable())))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleLockTimeout(PessimisticLockingFailureException e) {
        log.warn("Lock not acquired in time: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("CONFLICT_RETRYABLE")
            .message("Resource is busy, retry the request")
            .details(Map.of("retryable", "true"))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * A unique constraint lost a race the service did not anticipate, e.g.
     * one idempotency key sent for two different drivers at once.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("CONFLICT")
            .message("Request conflicts with existing data")
            .details(Map.of("retryable", "false"))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_INPUT")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_INPUT")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("INVALID_INPUT")
            .message("Malformed request: " + e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
