package com.classpulse.engage.api;

import com.classpulse.engage.error.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> validation(ValidationException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getIssues());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> invalidBody(MethodArgumentNotValidException ex) {
        List<ValidationIssue> issues = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> new ValidationIssue("INVALID_FIELD", e.getDefaultMessage(), e.getField()))
                .toList();
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiError("VALIDATION_ERROR", "Request body is invalid", issues));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(new ApiError("MALFORMED_REQUEST", "Request body could not be read", List.of()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> notFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex, List.of());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> conflict(ConflictException ex) {
        return respond(HttpStatus.CONFLICT, ex, List.of());
    }

    @ExceptionHandler(DataIntegrityException.class)
    public ResponseEntity<ApiError> integrity(DataIntegrityException ex) {
        log.error("Data integrity violation [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, List.of());
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, EngageException ex, List<ValidationIssue> details) {
        return ResponseEntity.status(status).body(new ApiError(ex.getCode(), ex.getMessage(), details));
    }

    public record ApiError(String error, String message, List<ValidationIssue> details) {}
}
