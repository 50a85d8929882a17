package com.pushit.exception;

import com.pushit.dto.response.ErrorResponse;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps exceptions to the structured {@link ErrorResponse} body. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex, WebRequest request) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult()
                .getAllErrors()
                .forEach(
                        error -> {
                            String fieldName =
                                    error instanceof FieldError fieldError
                                            ? fieldError.getField()
                                            : error.getObjectName();
                            errors.put(fieldName, error.getDefaultMessage());
                        });

        ErrorResponse errorResponse =
                createErrorResponse(
                        HttpStatus.BAD_REQUEST,
                        "VALIDATION_ERROR",
                        "Validation failed for one or more fields",
                        request);
        errorResponse.setValidationErrors(errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, WebRequest request) {
        Map<String, String> errors = new HashMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            errors.put(violation.getPropertyPath().toString(), violation.getMessage());
        }

        ErrorResponse errorResponse =
                createErrorResponse(
                        HttpStatus.BAD_REQUEST,
                        "CONSTRAINT_VIOLATION",
                        "Constraint validation failed",
                        request);
        errorResponse.setValidationErrors(errors);

        log.warn("Constraint violation: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            AccessDeniedException ex, WebRequest request) {
        log.warn("Access denied: {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "ACCESS_DENIED", "Access denied", request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            ResourceNotFoundException ex, WebRequest request) {
        log.warn("Resource not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "RESOURCE_NOT_FOUND", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(
            InsufficientBalanceException ex, WebRequest request) {
        log.warn("Insufficient balance: {}", ex.getMessage());
        return build(HttpStatus.PAYMENT_REQUIRED, "INSUFFICIENT_BALANCE", ex.getMessage(), request);
    }

    @ExceptionHandler({InvalidAmountException.class, CurrencyConversionException.class})
    public ResponseEntity<ErrorResponse> handleInvalidAmount(
            RuntimeException ex, WebRequest request) {
        log.warn("Invalid amount: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_AMOUNT", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalCampaignStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalCampaignState(
            IllegalCampaignStateException ex, WebRequest request) {
        log.warn("Illegal campaign state: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "ILLEGAL_CAMPAIGN_STATE", ex.getMessage(), request);
    }

    @ExceptionHandler(JobAcceptanceException.class)
    public ResponseEntity<ErrorResponse> handleJobAcceptance(
            JobAcceptanceException ex, WebRequest request) {
        log.warn("Job acceptance refused: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "JOB_NOT_ACCEPTED", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidToken(
            InvalidTokenException ex, WebRequest request) {
        log.warn("Invalid token: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_TOKEN", ex.getMessage(), request);
    }

    /** External service exceptions */
    @ExceptionHandler(PaymentGatewayException.class)
    public ResponseEntity<ErrorResponse> handlePaymentGateway(
            PaymentGatewayException ex, WebRequest request) {
        log.error("Payment gateway error: {}", ex.getMessage(), ex);
        return build(
                HttpStatus.BAD_GATEWAY,
                "PAYMENT_GATEWAY_ERROR",
                "Payment provider temporarily unavailable. Please try again later.",
                request);
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex, WebRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("API error: {}", ex.getMessage(), ex);
        } else {
            log.warn("API error: {}", ex.getMessage());
        }
        return build(ex.getStatus(), ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            ObjectOptimisticLockingFailureException ex, WebRequest request) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        return build(
                HttpStatus.CONFLICT,
                "CONCURRENT_MODIFICATION",
                "The resource was modified concurrently. Please retry.",
                request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, WebRequest request) {
        log.warn("Method not allowed: {}", ex.getMessage());
        return build(
                HttpStatus.METHOD_NOT_ALLOWED,
                "METHOD_NOT_ALLOWED",
                "HTTP method not supported for this endpoint",
                request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, WebRequest request) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        return build(
                HttpStatus.BAD_REQUEST,
                "MISSING_PARAMETER",
                "Missing required parameter: " + ex.getParameterName(),
                request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, WebRequest request) {
        log.warn("Type mismatch for parameter {}: {}", ex.getName(), ex.getMessage());
        return build(
                HttpStatus.BAD_REQUEST,
                "TYPE_MISMATCH",
                "Invalid parameter type for: " + ex.getName(),
                request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMalformedJson(
            HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Malformed JSON: {}", ex.getMessage());
        return build(
                HttpStatus.BAD_REQUEST,
                "MALFORMED_JSON",
                "Invalid JSON format in request body",
                request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, WebRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return build(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "INTERNAL_ERROR",
                "An unexpected error occurred. Please try again later.",
                request);
    }

    private ResponseEntity<ErrorResponse> build(
            HttpStatus status, String errorCode, String message, WebRequest request) {
        return ResponseEntity.status(status)
                .body(createErrorResponse(status, errorCode, message, request));
    }

    private ErrorResponse createErrorResponse(
            HttpStatus status, String errorCode, String message, WebRequest request) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .path(extractPath(request))
                .requestId(UUID.randomUUID().toString())
                .build();
    }

    private String extractPath(WebRequest request) {
        String description = request.getDescription(false);
        return description != null ? description.replace("uri=", "") : "unknown";
    }
}
