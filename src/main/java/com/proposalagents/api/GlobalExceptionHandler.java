package com.proposalagents.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.stream.Collectors;

/**
 * Maps failures at the HTTP boundary to {@code {status: "error", message}} bodies.
 * Pipeline failures never get here; they are reported inside a normal 200 response.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Invalid request: {}", message);
        return ResponseEntity.badRequest().body(ApiError.of("Invalid request: " + message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(ApiError.of("Request body must be a JSON object."));
    }

    @ExceptionHandler(ResponseStatusException.class)
    ResponseEntity<ApiError> handleStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        log.warn("Request failed with {}: {}", status.value(), ex.getReason());
        return ResponseEntity.status(status).body(ApiError.of(ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request failed with {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status).body(ApiError.of(errorResponse.getBody().getDetail()));
        }
        log.error("Unexpected error", ex);
        return ResponseEntity.internalServerError()
                .body(ApiError.of("An unexpected error occurred: " + ex.getMessage()));
    }

    record ApiError(String status, String message) {

        static ApiError of(String message) {
            return new ApiError("error", message);
        }
    }
}
