package com.tazifor.trips.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<?> handleInvalidInput(InvalidInputException e) {
        return ResponseEntity.badRequest().body(
                Map.of("error", "INVALID_INPUT", "message", e.getMessage())
        );
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<?> handleUnreadable(Exception e) {
        return ResponseEntity.badRequest().body(
                Map.of("error", "VALIDATION_ERROR", "message", String.valueOf(e.getMessage()))
        );
    }

    @ExceptionHandler(TripImportException.class)
    public ResponseEntity<?> handleImport(TripImportException e) {
        log.error("Trip import failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "IMPORT_FAILED", "message", e.getMessage()));
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class
    })
    public ResponseEntity<?> handleFrameworkError(Exception e) {
        return frameworkError((ErrorResponse) e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleAny(Exception e) {
        // remaining Spring MVC client errors carry their own status
        if (e instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            return frameworkError(errorResponse);
        }
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", String.valueOf(e.getMessage())));
    }

    private static ResponseEntity<?> frameworkError(ErrorResponse error) {
        HttpStatusCode status = error.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String code = resolved != null ? resolved.name() : "HTTP_" + status.value();
        String message = error.getBody().getDetail();
        return ResponseEntity.status(status)
                .headers(error.getHeaders())
                .body(Map.of("error", code, "message", String.valueOf(message)));
    }
}
