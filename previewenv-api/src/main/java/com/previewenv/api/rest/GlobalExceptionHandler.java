package com.previewenv.api.rest;

import com.previewenv.core.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the exception taxonomy onto HTTP statuses with a uniform error body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({InvalidStateTransitionException.class, OptimisticLockException.class})
    public ResponseEntity<ErrorResponse> handleConflict(PreviewEnvException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler({InvalidActionException.class, InvalidConfigurationException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(PreviewEnvException ex) {
        return build(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of("VALIDATION_ERROR", "Malformed request: " + ex.getMessage()));
    }

    @ExceptionHandler(ResourceExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleExhausted(ResourceExhaustedException ex) {
        log.error("Capacity exhausted: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(PreviewEnvException.class)
    public ResponseEntity<ErrorResponse> handlePreviewEnv(PreviewEnvException ex) {
        log.error("Request failed with {}: {}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("INTERNAL_ERROR", "Internal error"));
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, PreviewEnvException ex) {
        return ResponseEntity.status(status).body(ErrorResponse.of(ex.getErrorCode(), ex.getMessage()));
    }
}
