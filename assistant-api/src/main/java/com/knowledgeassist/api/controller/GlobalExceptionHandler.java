package com.knowledgeassist.api.controller;

import com.knowledgeassist.api.service.ingestion.DocumentRejectedException;
import com.knowledgeassist.api.service.query.QueryException;
import com.knowledgeassist.api.service.query.QueryFailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String SECURITY_VIOLATION_MESSAGE = "Security violation detected";

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<Map<String, Object>> handleQueryException(QueryException exception) {
        // Isolation details stay in the audit trail.
        String message = exception.kind() == QueryFailureKind.SECURITY_VIOLATION
                ? SECURITY_VIOLATION_MESSAGE
                : exception.getMessage();
        if (exception.kind() == QueryFailureKind.UPSTREAM_FAILURE) {
            log.warn("Upstream failure: {}", exception.getMessage());
        }
        return ResponseEntity.status(exception.status())
                .body(Map.of(
                        "error", message
                ));
    }

    @ExceptionHandler(DocumentRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleDocumentRejected(DocumentRejectedException exception) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", exception.getMessage()
                ));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException exception) {
        String detail = exception.getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of(
                        "error", detail.isEmpty() ? "Invalid request" : detail
                ));
    }
}
