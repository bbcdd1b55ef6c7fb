package com.leaflog.controller;

import com.leaflog.log.LogParseException;
import com.leaflog.service.DuplicateSequenceException;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(LogParseException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleMalformedLogs(LogParseException e) {
        return Map.of(
                "error", "MALFORMED_LOGS",
                "message", e.getMessage(),
                "line", e.getLineIndex()
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalid(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.put(error.getField(), String.valueOf(error.getDefaultMessage()));
        }
        return Map.of(
                "error", "BAD_REQUEST",
                "fields", fields
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler(DuplicateSequenceException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleInconsistent(DuplicateSequenceException e) {
        return Map.of(
                "error", "DATA_INTEGRITY",
                "message", e.getMessage()
        );
    }
}
