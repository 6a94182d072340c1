package com.resolveai.ingestor.controllers;

import com.resolveai.entry.exceptions.CircularReferenceException;
import com.resolveai.entry.exceptions.UnsupportedPayloadException;
import com.resolveai.ingestor.models.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class CodecExceptionHandler {

    @ExceptionHandler(UnsupportedPayloadException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedPayload(UnsupportedPayloadException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "UNSUPPORTED_PAYLOAD", e.getMessage());
    }

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularReference(CircularReferenceException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "CIRCULAR_REFERENCE", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRecord(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_RECORD", e.getMessage());
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        log.warn("REQUEST_FAILED | status={} | error={} | message={}", status.value(), code, message);
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(code)
                .message(message)
                .build());
    }
}
