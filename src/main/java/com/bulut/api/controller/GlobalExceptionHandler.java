package com.bulut.api.controller;

import com.bulut.api.dto.ErrorResponse;
import com.bulut.common.exception.BulutException;
import com.bulut.common.exception.ErrorCategory;
import com.bulut.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 *
 * Every failure is rendered as {@code {code, message, status}}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BulutException.class)
    public ResponseEntity<ErrorResponse> handleBulutException(BulutException e) {
        HttpStatus status = statusFor(e.getCode().getCategory());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.getCode(), e.getMessage(), e);
        } else {
            log.debug("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        return buildErrorResponse(status, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_FORMAT, "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_FORMAT, "Malformed request body", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_FORMAT,
            "Missing header " + e.getHeaderName(), null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_FORMAT,
            "Missing parameter " + e.getParameterName(), null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_FORMAT,
            "Invalid value for " + e.getName(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR,
            "An unexpected error occurred", null);
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RAIL -> HttpStatus.BAD_GATEWAY;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, ErrorCode code, String message,
                                                             Map<String, String> fields) {
        ErrorResponse error = ErrorResponse.builder()
            .code(code.name())
            .message(message)
            .status(status.value())
            .fields(fields)
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
