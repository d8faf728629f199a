package com.z254.arbiter.api.v1;

import com.z254.arbiter.api.dto.ErrorResponse;
import com.z254.arbiter.domain.exception.ABTestConfigurationException;
import com.z254.arbiter.domain.exception.InvalidModelStateException;
import com.z254.arbiter.domain.exception.ModelNotFoundException;
import com.z254.arbiter.domain.exception.ModelTrainingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps registry and validation failures to structured error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.put(error.getField(), error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), null);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", ex.getReason(), null);
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ModelNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "Model Not Found", ex.getMessage(),
                Map.of("versionId", String.valueOf(ex.getVersionId())));
    }

    @ExceptionHandler(InvalidModelStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidModelStateException ex) {
        return build(HttpStatus.CONFLICT, "Invalid Model State", ex.getMessage(), null);
    }

    @ExceptionHandler(ABTestConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleAbTestConfiguration(ABTestConfigurationException ex) {
        return build(HttpStatus.BAD_REQUEST, "Invalid A/B Test", ex.getMessage(), null);
    }

    @ExceptionHandler(ModelTrainingException.class)
    public ResponseEntity<ErrorResponse> handleTraining(ModelTrainingException ex) {
        log.error("Model training failed", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Training Failed", ex.getMessage(), null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                Map<String, String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .build());
    }
}
