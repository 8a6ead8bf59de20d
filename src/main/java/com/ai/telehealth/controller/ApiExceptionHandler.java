package com.ai.telehealth.controller;

import com.ai.telehealth.exception.ExternalProviderException;
import com.ai.telehealth.exception.InvalidTimeRangeException;
import com.ai.telehealth.exception.InvalidTransitionException;
import com.ai.telehealth.exception.ParticipantAccessException;
import com.ai.telehealth.exception.ResourceNotFoundException;
import com.ai.telehealth.exception.SlotConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTimeRangeException.class)
    public ResponseEntity<Map<String, Object>> invalidRange(InvalidTimeRangeException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_TIME_RANGE", e.getMessage());
    }

    @ExceptionHandler(SlotConflictException.class)
    public ResponseEntity<Map<String, Object>> conflict(SlotConflictException e) {
        return error(HttpStatus.CONFLICT, e.getReason().name(), e.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> invalidTransition(InvalidTransitionException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_TRANSITION", e.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ParticipantAccessException.class)
    public ResponseEntity<Map<String, Object>> forbidden(ParticipantAccessException e) {
        return error(HttpStatus.FORBIDDEN, "NOT_A_PARTICIPANT", e.getMessage());
    }

    @ExceptionHandler(ExternalProviderException.class)
    public ResponseEntity<Map<String, Object>> externalFailure(ExternalProviderException e) {
        log.error("External provider failure: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "EXTERNAL_PROVIDER_ERROR", e.getMessage());
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> concurrentUpdate(ObjectOptimisticLockingFailureException e) {
        log.warn("Concurrent update rejected: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "The record was modified concurrently. Reload and retry.");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", detail);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> missingHeader(MissingRequestHeaderException e) {
        return error(HttpStatus.BAD_REQUEST, "MISSING_HEADER", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> typeMismatch(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid value for '" + e.getName() + "'.");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String detail) {
        return ResponseEntity.status(status).body(Map.of("error", code, "detail", detail == null ? "" : detail));
    }
}
