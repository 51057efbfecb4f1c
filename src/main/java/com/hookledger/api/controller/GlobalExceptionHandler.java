package com.hookledger.api.controller;

import com.hookledger.common.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AlreadyInitializedException.class)
    public ResponseEntity<Map<String, String>> handleAlreadyInitialized(AlreadyInitializedException e) {
        return buildErrorResponse(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(NotInitializedException.class)
    public ResponseEntity<Map<String, String>> handleNotInitialized(NotInitializedException e) {
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Map<String, String>> handleUnauthorized(UnauthorizedException e) {
        return buildErrorResponse(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(GateRejectedException.class)
    public ResponseEntity<Map<String, String>> handleGateRejected(GateRejectedException e) {
        ResponseEntity<Map<String, String>> response = buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, e);
        response.getBody().put("gate", e.getGateName());
        return response;
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<Map<String, String>> handleInsufficientBalance(InsufficientBalanceException e) {
        return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(OverflowException.class)
    public ResponseEntity<Map<String, String>> handleOverflow(OverflowException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<Map<String, String>> handleConcurrencyFailure(ConcurrencyFailureException e) {
        log.warn("Ledger lock not acquired: {}", e.getMessage());
        return buildErrorResponse(HttpStatus.CONFLICT, "The ledger is busy; retry the operation", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return buildErrorResponse(HttpStatus.UNAUTHORIZED, e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred: " + e.getMessage(), null);
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, LedgerException e) {
        return buildErrorResponse(status, e.getMessage(), e.getErrorKind());
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, String message,
                                                                   LedgerErrorKind kind) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("status", String.valueOf(status.value()));
        if (kind != null) {
            error.put("errorKind", kind.name());
        }
        return ResponseEntity.status(status).body(error);
    }
}
