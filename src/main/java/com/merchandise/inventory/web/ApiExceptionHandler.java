package com.merchandise.inventory.web;

import com.merchandise.inventory.service.ImportApplyException;
import com.merchandise.inventory.service.InvalidImportFormatException;
import com.merchandise.inventory.service.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps run-level failures to a single {error, message} body
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidImportFormatException.class)
    public ResponseEntity<Map<String, String>> invalidFormat(InvalidImportFormatException e) {
        log.warn("Rejected import: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "INVALID_FORMAT", e.getMessage());
    }

    @ExceptionHandler(ImportApplyException.class)
    public ResponseEntity<Map<String, String>> applyFailed(ImportApplyException e) {
        return body(HttpStatus.CONFLICT, "APPLY_FAILED", e.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> sessionNotFound(SessionNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> invalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message == null ? "" : message));
    }
}
