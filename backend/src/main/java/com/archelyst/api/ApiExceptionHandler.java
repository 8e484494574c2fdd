/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.api;

import com.archelyst.application.dispatch.AllProvidersExhaustedException;
import com.archelyst.application.dispatch.DeadlineExceededException;
import com.archelyst.application.dispatch.ProviderAttempt;
import com.archelyst.application.dispatch.UnknownCapabilityException;
import com.archelyst.config.RequestIdFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AllProvidersExhaustedException.class)
    public ResponseEntity<ApiErrorResponse> handleExhausted(AllProvidersExhaustedException ex) {
        return respond(HttpStatus.BAD_GATEWAY, "ALL_PROVIDERS_EXHAUSTED", ex.getMessage(), ex.getAttempts());
    }

    @ExceptionHandler(DeadlineExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleDeadline(DeadlineExceededException ex) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, "DEADLINE_EXCEEDED", ex.getMessage(), ex.getAttempts());
    }

    @ExceptionHandler(UnknownCapabilityException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownCapability(UnknownCapabilityException ex) {
        return respond(HttpStatus.NOT_FOUND, "UNKNOWN_CAPABILITY", ex.getMessage(), List.of());
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getStatus().name(), ex.getMessage(), List.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), List.of());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request", List.of());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NoResourceFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Resource not found", List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        String requestId = currentRequestId();
        log.error("Unhandled exception requestId={}", requestId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error", List.of());
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message, List<ProviderAttempt> attempts) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                currentRequestId(),
                attempts
        );
        return ResponseEntity.status(status).body(body);
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
