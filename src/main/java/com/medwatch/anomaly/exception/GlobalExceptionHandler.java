package com.medwatch.anomaly.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(InvalidRuleException.class)
    public ResponseEntity<ApiError> handleInvalidRule(InvalidRuleException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Rule", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(DataPointValidationException.class)
    public ResponseEntity<ApiError> handleInvalidDataPoint(DataPointValidationException ex,
                                                           HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                "Data point failed validation", request, ex.getErrorCode(), ex.getErrors());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                       HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, null, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex,
                                                     HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request",
                ex.getMostSpecificCause().getMessage(), request, null, null);
    }

    @ExceptionHandler(MedWatchException.class)
    public ResponseEntity<ApiError> handleMedWatch(MedWatchException ex, HttpServletRequest request) {
        log.error("Request to {} failed: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Processing Error", ex.getMessage(),
                request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request, null, null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String error, String message,
                                           HttpServletRequest request, String errorCode,
                                           List<String> details) {
        ApiError body = ApiError.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .errorCode(errorCode)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
