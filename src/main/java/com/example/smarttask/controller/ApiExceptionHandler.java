package com.example.smarttask.controller;

import com.example.smarttask.exception.TaskNotFoundException;
import com.example.smarttask.response.ErrorResponse;
import com.example.smarttask.validation.FieldViolation;
import com.example.smarttask.validation.ValidationException;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(TaskNotFoundException ex) {
        log.debug("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("Task not found"));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> invalid(ValidationException ex) {
        return unprocessable(ex.getViolations().stream().map(FieldViolation::describe).toList());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException ex) {
        List<String> reasons = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldViolation(toSnakeCase(error.getField()), error.getDefaultMessage()))
                .map(FieldViolation::describe)
                .sorted()
                .toList();
        return unprocessable(reasons.isEmpty() ? List.of("Invalid request body") : reasons);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request body: {}", ex.getMessage());
        return unprocessable(List.of("Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> typeMismatch(MethodArgumentTypeMismatchException ex) {
        return unprocessable(List.of(
                new FieldViolation(ex.getName(), "invalid value '" + ex.getValue() + "'").describe()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> storeFailure(DataAccessException ex) {
        log.error("Task store access failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("Task store unavailable"));
    }

    private ResponseEntity<ErrorResponse> unprocessable(List<String> reasons) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ErrorResponse.of(reasons));
    }

    private static String toSnakeCase(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }
}
