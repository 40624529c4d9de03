package com.lumen.grading.controller.api;

import java.time.LocalDateTime;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.lumen.grading.exception.IllegalStateTransitionException;
import com.lumen.grading.exception.InvalidOverrideException;
import com.lumen.grading.exception.InvalidUploadException;
import com.lumen.grading.exception.SubmissionNotFoundException;
import com.lumen.grading.exception.SyncJobConflictException;
import com.lumen.grading.exception.SyncJobNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps domain exceptions to JSON error responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({SubmissionNotFoundException.class, SyncJobNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({IllegalStateTransitionException.class, SyncJobConflictException.class,
            ObjectOptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> conflict(RuntimeException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({InvalidOverrideException.class, InvalidUploadException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * A broken invariant, not a request the caller can fix.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> internalError(IllegalStateException e) {
        log.error("Request failed on an inconsistent state", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return error(HttpStatus.BAD_REQUEST, message);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), status.getReasonPhrase(),
                message, LocalDateTime.now()));
    }

    public record ErrorResponse(
            int status,
            String error,
            String message,
            LocalDateTime timestamp
    ) {}
}
