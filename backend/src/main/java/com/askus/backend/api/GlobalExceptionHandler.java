package com.askus.backend.api;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps exceptions escaping the controllers to {@code {"error": {...}}} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, ApiError>> handleApi(ApiException e, HttpServletRequest request) {
        int code = e.status();
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "error" : e.getMessage();
        String errCode =
                (code == 400) ? "BAD_REQUEST" :
                (code == 401) ? "UNAUTHORIZED" :
                (code == 403) ? "FORBIDDEN" :
                (code == 404) ? "NOT_FOUND" :
                "ERROR";
        log.warn("[{}] {} - {} {}", request.getMethod(), request.getRequestURI(), code, msg);
        return error(code, ApiError.of(errCode, msg));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, ApiError>> handleBadRequest(Exception e, HttpServletRequest request) {
        log.warn("[{}] {} - bad request: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        String msg = (e instanceof HttpMessageNotReadableException) ? "malformed request body" : e.getMessage();
        return error(400, ApiError.of("BAD_REQUEST", msg));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, ApiError>> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("[{}] {} - unexpected error", request.getMethod(), request.getRequestURI(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR.value(), ApiError.of("INTERNAL_ERROR", "unexpected error"));
    }

    private static ResponseEntity<Map<String, ApiError>> error(int status, ApiError err) {
        return ResponseEntity.status(status).body(Map.of("error", err));
    }
}
