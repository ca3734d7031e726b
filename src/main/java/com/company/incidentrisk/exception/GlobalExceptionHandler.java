package com.company.incidentrisk.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TelemetryValidationException.class)
    public ResponseEntity<Map<String, Object>> handleTelemetryValidation(TelemetryValidationException ex) {
        Map<String, Object> response = buildBody(HttpStatus.BAD_REQUEST, ex.getMessage());
        response.put("violations", ex.getViolations());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleModelNotFound(ModelNotFoundException ex) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(AlertNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleAlertNotFound(AlertNotFoundException ex) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(InsufficientTrainingDataException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientTrainingData(InsufficientTrainingDataException ex) {
        Map<String, Object> response = buildBody(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        response.put("rowCount", ex.getRowCount());
        response.put("positiveCount", ex.getPositiveCount());
        response.put("negativeCount", ex.getRowCount() - ex.getPositiveCount());
        response.put("minRows", ex.getMinRows());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    @ExceptionHandler(BacktestDataException.class)
    public ResponseEntity<Map<String, Object>> handleBacktestData(BacktestDataException ex) {
        Map<String, Object> response = buildBody(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        response.put("rowCount", ex.getRowCount());
        response.put("positiveCount", ex.getPositiveCount());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    @ExceptionHandler(TrainingInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleTrainingInProgress(TrainingInProgressException ex) {
        return buildErrorResponse(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(InvalidAlertTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidAlertTransitionException ex) {
        return buildErrorResponse(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(OperationInterruptedException.class)
    public ResponseEntity<Map<String, Object>> handleInterrupted(OperationInterruptedException ex) {
        log.warn("Operation interrupted: {}", ex.getMessage());
        Map<String, Object> response = buildBody(HttpStatus.REQUEST_TIMEOUT, ex.getMessage());
        response.put("partialResult", ex.getPartialResult());
        return ResponseEntity.status(HttpStatus.REQUEST_TIMEOUT).body(response);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store unavailable", ex);
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex) {
        return buildErrorResponse(HttpStatus.FORBIDDEN, "Access denied");
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class, ConstraintViolationException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage())
        );

        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", Instant.now());
        response.put("status", HttpStatus.BAD_REQUEST.value());
        response.put("error", "Validation Failed");
        response.put("errors", errors);

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(buildBody(status, message));
    }

    private Map<String, Object> buildBody(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", Instant.now());
        response.put("status", status.value());
        response.put("error", status.getReasonPhrase());
        response.put("message", message);
        return response;
    }
}
