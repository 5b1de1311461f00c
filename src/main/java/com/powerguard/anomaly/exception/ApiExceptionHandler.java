package com.powerguard.anomaly.exception;

import com.powerguard.anomaly.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownModelException.class)
    public ResponseEntity<ErrorResponse> handleUnknownModel(UnknownModelException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(),
                Map.of("model", String.valueOf(ex.getModelId())));
    }

    @ExceptionHandler(InvalidThresholdException.class)
    public ResponseEntity<ErrorResponse> handleInvalidThreshold(InvalidThresholdException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(),
                Map.of("threshold", ex.getThreshold()));
    }

    @ExceptionHandler(EmptyBatchException.class)
    public ResponseEntity<ErrorResponse> handleEmptyBatch(EmptyBatchException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getMessage(),
                Map.of("meters_requested", ex.getMetersRequested()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Result store unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getCode(), "Result store unavailable", Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(DetectionException.class)
    public ResponseEntity<ErrorResponse> handleDetection(DetectionException ex) {
        log.error("Detection failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCode(), ex.getMessage(), Map.of());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, details));
    }
}
