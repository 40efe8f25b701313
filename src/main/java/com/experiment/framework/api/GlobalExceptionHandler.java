package com.experiment.framework.api;

import com.experiment.framework.core.analysis.StatisticalAnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the experiments API. Returns consistent JSON
 * and appropriate status codes for validation, lifecycle and analysis errors.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (a, b) -> a));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(ExperimentValidationException.class)
    public ResponseEntity<Map<String, String>> handleInvalidExperiment(ExperimentValidationException ex) {
        log.warn("Rejected experiment request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_EXPERIMENT", ex);
    }

    @ExceptionHandler(UnknownStrategyException.class)
    public ResponseEntity<Map<String, String>> handleUnknownStrategy(UnknownStrategyException ex) {
        return error(HttpStatus.BAD_REQUEST, "UNKNOWN_STRATEGY", ex);
    }

    @ExceptionHandler(ExperimentNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ExperimentNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "EXPERIMENT_NOT_FOUND", ex);
    }

    @ExceptionHandler(InvalidExperimentStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidState(InvalidExperimentStateException ex) {
        return error(HttpStatus.CONFLICT, "INVALID_EXPERIMENT_STATE", ex);
    }

    @ExceptionHandler(StatisticalAnalysisException.class)
    public ResponseEntity<Map<String, String>> handleAnalysis(StatisticalAnalysisException ex) {
        log.warn("Analysis failed: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "ANALYSIS_FAILED", ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, Throwable ex) {
        return ResponseEntity
                .status(status)
                .body(Map.of("error", code, "message", getMessageOrCause(ex)));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
