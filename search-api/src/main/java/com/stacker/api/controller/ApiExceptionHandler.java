package com.stacker.api.controller;

import com.stacker.model.StackerValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to responses: rejected requests to 400 with per-field messages where known,
 * document-store and database failures to 503 so clients retry.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String DETAIL = "detail";

    @ExceptionHandler(StackerValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(StackerValidationException e) {
        log.info("Rejected request: {}", e.getMessage());
        Map<String, String> body = e.getFieldErrors().isEmpty()
                ? Map.of(DETAIL, e.getMessage())
                : e.getFieldErrors();
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidArgument(MethodArgumentNotValidException e) {
        Map<String, String> body = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            body.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.info("Rejected request: {}", body);
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, String>> handleUnreadable(Exception e) {
        log.info("Rejected request: {}", e.getMessage());
        return new ResponseEntity<>(Map.of(DETAIL, "Malformed request: " + e.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleBackendFailure(IOException e) {
        log.error("Stacker backend request failed", e);
        return new ResponseEntity<>(Map.of(DETAIL, "Search backend unavailable, please retry."),
                HttpStatus.SERVICE_UNAVAILABLE);
    }
}
