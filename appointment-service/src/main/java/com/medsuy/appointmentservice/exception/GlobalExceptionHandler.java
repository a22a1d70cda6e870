package com.medsuy.appointmentservice.exception;

import com.medsuy.common.dto.ErrorResponse;
import com.medsuy.common.dto.ValidationErrorResponse;
import com.medsuy.common.exception.AccessDeniedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // seconds a client should wait before resubmitting after a lock timeout
    private static final String LOCK_TIMEOUT_RETRY_AFTER = "1";

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ErrorResponse buildError(HttpStatus status, String message, String errorCode,
            HttpServletRequest request, String correlationId) {
        return ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();
    }

    @ExceptionHandler(RequesterNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRequesterNotFoundException(
            RequesterNotFoundException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.debug("[{}] Requester not found - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(
                buildError(HttpStatus.NOT_FOUND, ex.getMessage(), "REQUESTER_NOT_FOUND", request, correlationId),
                HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SlotNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSlotNotFoundException(
            SlotNotFoundException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.debug("[{}] Slot not found - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(
                buildError(HttpStatus.NOT_FOUND, ex.getMessage(), "SLOT_NOT_FOUND", request, correlationId),
                HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SlotUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSlotUnavailableException(
            SlotUnavailableException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.info("[{}] Slot conflict - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(
                buildError(HttpStatus.CONFLICT, ex.getMessage(), "SLOT_UNAVAILABLE", request, correlationId),
                HttpStatus.CONFLICT);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.info("[{}] Access denied - Path: {} - {}", correlationId, request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(
                buildError(HttpStatus.FORBIDDEN, ex.getMessage(), "ACCESS_DENIED", request, correlationId),
                HttpStatus.FORBIDDEN);
    }

    /**
     * Lock wait exceeded: the request changed nothing and may be resubmitted as is.
     */
    @ExceptionHandler(SlotLockTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleSlotLockTimeoutException(
            SlotLockTimeoutException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.warn("[{}] Slot lock timeout - Path: {} - Client should retry", correlationId, request.getRequestURI());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, LOCK_TIMEOUT_RETRY_AFTER)
                .body(buildError(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "SLOT_LOCK_TIMEOUT",
                        request, correlationId));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        String message = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());

        return new ResponseEntity<>(
                buildError(HttpStatus.BAD_REQUEST, message, "INVALID_ARGUMENT", request, correlationId),
                HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();

        return new ResponseEntity<>(
                buildError(HttpStatus.BAD_REQUEST, "Malformed request body", "MALFORMED_REQUEST", request,
                        correlationId),
                HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        return new ResponseEntity<>(
                buildError(HttpStatus.INTERNAL_SERVER_ERROR,
                        "An unexpected error occurred. Please contact support if the problem persists.",
                        "INTERNAL_SERVER_ERROR", request, correlationId),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
