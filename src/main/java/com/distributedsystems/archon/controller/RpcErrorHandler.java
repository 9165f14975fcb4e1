package com.distributedsystems.archon.controller;

import com.distributedsystems.archon.error.ArchonException;
import com.distributedsystems.archon.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to {@code {"error": KIND, "message": ...}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class RpcErrorHandler {

    @ExceptionHandler(ArchonException.class)
    public ResponseEntity<ErrorResponse> handleArchon(ArchonException e) {
        ErrorKind kind = e.getKind();
        if (kind.getCategory() == ErrorKind.Category.EXTERNAL || kind.getCategory() == ErrorKind.Category.INTERNAL) {
            log.warn("RPC failed with {}: {}", kind, e.getMessage());
        } else {
            log.debug("RPC rejected with {}: {}", kind, e.getMessage());
        }
        return ResponseEntity.status(statusFor(kind.getCategory())).body(new ErrorResponse(kind.name(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorKind.INVALID_REQUEST.name(), "malformed request body"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStore(DataAccessException e) {
        log.error("Local store failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(ErrorKind.STORE_UNAVAILABLE.name(), "local store unavailable"));
    }

    static HttpStatus statusFor(ErrorKind.Category category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case EXTERNAL -> HttpStatus.BAD_GATEWAY;
            case INTERNAL -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    public record ErrorResponse(String error, String message) {}
}
