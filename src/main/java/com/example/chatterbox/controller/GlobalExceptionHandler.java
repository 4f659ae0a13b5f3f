package com.example.chatterbox.controller;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.example.chatterbox.dto.ErrorResponse;

import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns every exception that escapes a handler into the {@code {"error": ...}} body.
 * Store transactions have already been rolled back by the time these run.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String BAD_REQUEST = "Bad Request";
    static final String NOT_FOUND = "Resource not found";
    static final String INTEGRITY_VIOLATION = "Failed to save message due to data integrity issue.";
    static final String INTERNAL_ERROR = "Internal Server Error";

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, BAD_REQUEST);
    }

    // ids only match integers
    @ExceptionHandler({MethodArgumentTypeMismatchException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(Exception e) {
        return error(HttpStatus.NOT_FOUND, NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> methodNotAllowed(HttpRequestMethodNotSupportedException e) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> unsupportedMediaType(HttpMediaTypeNotSupportedException e) {
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> integrityViolation(DataIntegrityViolationException e) {
        log.warn("Integrity violation while saving message: {}", e.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, INTEGRITY_VIOLATION);
    }

    /**
     * Remaining Spring MVC request errors (not acceptable, missing parameter, ...) keep their own 4xx status.
     */
    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<ErrorResponse> requestError(Exception e) {
        if (!(e instanceof org.springframework.web.ErrorResponse response)) {
            return unexpected(e);
        }
        HttpStatusCode status = response.getStatusCode();
        log.debug("Request rejected with {}: {}", status.value(), e.getMessage());
        HttpStatus known = HttpStatus.resolve(status.value());
        String message = known != null ? known.getReasonPhrase() : "Request failed";
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Unhandled error while processing request", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
