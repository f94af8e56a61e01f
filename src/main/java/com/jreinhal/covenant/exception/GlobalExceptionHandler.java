package com.jreinhal.covenant.exception;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(DocumentNotFoundException ex) {
        log.debug("Lookup failed: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "Document not found");
    }

    @ExceptionHandler(DuplicateDocumentException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateDocumentException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "A document with identical contents already exists",
                        "existingDocumentId", ex.getExistingDocumentId(),
                        "timestamp", Instant.now().toString()));
    }

    @ExceptionHandler(DocumentBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(DocumentBusyException ex) {
        return error(HttpStatus.CONFLICT, "Document is currently being processed");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        log.debug("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request");
    }

    @ExceptionHandler(AnswerUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleAnswerUnavailable(AnswerUnavailableException ex) {
        log.warn("Answer unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Couldn't generate an answer right now");
    }

    @ExceptionHandler(RetrievalUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleRetrievalUnavailable(RetrievalUnavailableException ex) {
        log.warn("Retrieval unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Search is temporarily unavailable");
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleOverload(RejectedExecutionException ex) {
        log.warn("Request rejected, worker pool saturated: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Server is busy, retry later");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message, "timestamp", Instant.now().toString()));
    }

    private static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        // No paths, class names or stack fragments in client responses
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }
}
