package com.kpiforecast.exception;

import com.kpiforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", "VALIDATION_FAILED", request, fieldErrors, null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more parameters failed validation", "VALIDATION_FAILED", request, fieldErrors, null);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more parameters failed validation", "VALIDATION_FAILED", request, null, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, "TYPE_MISMATCH", request, null, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be read",
                     "MALFORMED_REQUEST", request, null, null);
    }

    @ExceptionHandler({InvalidMetricException.class, UnsupportedModelException.class})
    public ResponseEntity<ApiError> handleBadInput(
            KpiForecastException ex, HttpServletRequest request) {
        log.warn("Rejected request | path={} | code={} | reason={}",
                 request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), ex.getErrorCode(), request, null, null);
    }

    @ExceptionHandler({NoDataException.class, JobNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            KpiForecastException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), ex.getErrorCode(), request, null, null);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficientData(
            InsufficientDataException ex, HttpServletRequest request) {
        log.warn("Insufficient data | path={} | required={} | available={}",
                 request.getRequestURI(), ex.getRequired(), ex.getAvailable());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getMessage(), ex.getErrorCode(),
                     request, null, Map.of("required", ex.getRequired(), "available", ex.getAvailable()));
    }

    @ExceptionHandler(NoUsableModelException.class)
    public ResponseEntity<ApiError> handleNoUsableModel(
            NoUsableModelException ex, HttpServletRequest request) {
        log.warn("No usable model | path={} | failures={}", request.getRequestURI(), ex.getFailures());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "No Usable Model", ex.getMessage(), ex.getErrorCode(),
                     request, null, Map.of("failures", ex.getFailures()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "INVALID_ARGUMENT", request, null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     message, "INTERNAL_ERROR", request, null, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message, String errorCode,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors,
            Map<String, Object> details) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .errorCode(errorCode)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .details(details)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
