package com.gsm.fraud.controller;

import com.gsm.fraud.exception.ModelConfigurationException;
import com.gsm.fraud.exception.ResultNotFoundException;
import com.gsm.fraud.exception.ResultStoreException;
import com.gsm.fraud.exception.SchemaValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.Map;

/**
 * Maps pipeline exceptions to JSON error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SchemaValidationException.class)
    public ResponseEntity<ErrorResponse> handleSchema(SchemaValidationException ex) {
        Object details = ex.getMissingColumns().isEmpty() ? null : Map.of("missingColumns", ex.getMissingColumns());
        return respond(HttpStatus.BAD_REQUEST, "Schema Error", ex.getMessage(), details);
    }

    @ExceptionHandler(ResultNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResultNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), Map.of("resultId", String.valueOf(ex.getResultId())));
    }

    @ExceptionHandler(ModelConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfig(ModelConfigurationException ex) {
        log.error("Model configuration error: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error",
                "The loaded transform and classifier artifacts do not match: " + ex.getMessage(), null);
    }

    @ExceptionHandler(ResultStoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(ResultStoreException ex) {
        log.error("Result store failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Result Store Error", ex.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "File Upload Error",
                "Uploaded file exceeds the maximum allowed size", Map.of("maxUploadSize", ex.getMaxUploadSize()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected server error", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message, Object details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now().toEpochMilli())
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private long timestamp;
        private int status;
        private String error;
        private String message;
        private Object details;
    }
}
