package com.hwsc.userservice.exception;

import com.hwsc.userservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final String PROBLEM_BASE = "https://hwsc.org/problems/";

    private final ErrorResponseWriter writer;

    // ---------- Domain exceptions ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        if (ex.getCode() == StatusCode.INTERNAL) {
            log.error("Request {} failed: {}", req.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.debug("ApiException: code={}, status={}, detail={}", ex.getCode(), ex.getStatus(), ex.getMessage());
        }
        writer.write(req, resp, ex.getStatus(), ex.getCode(), ex.getType(), ex.getTitle(), safeDetail(ex.getMessage()));
    }

    // ---------- Request-shape errors ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        var details = ex.getBindingResult().getFieldErrors().stream()
                .limit(5)
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.BAD_REQUEST, StatusCode.INVALID_ARGUMENT,
                PROBLEM_BASE + "invalid-argument",
                "Invalid Argument",
                details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public void handleUnreadable(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull HttpMessageNotReadableException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, StatusCode.INVALID_ARGUMENT,
                PROBLEM_BASE + "nil-request",
                "Missing Request Data",
                "Malformed or missing request body.");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED, StatusCode.INVALID_ARGUMENT,
                PROBLEM_BASE + "method-not-allowed",
                "Method Not Allowed",
                "HTTP method not supported for this endpoint.");
    }

    // ---------- Store conflicts ----------

    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.debug("DataIntegrityViolation: {}", ex.getMostSpecificCause().getMessage());
        writer.write(req, resp, HttpStatus.CONFLICT, StatusCode.ALREADY_EXISTS,
                PROBLEM_BASE + "conflict",
                "Conflict",
                "A conflicting resource already exists.");
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception", ex);
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR, StatusCode.INTERNAL,
                PROBLEM_BASE + "internal-error",
                "Internal Server Error",
                "An unexpected error occurred.");
    }

    private String safeDetail(String s) {
        return (s == null || s.isBlank()) ? "Request could not be processed." : s;
    }
}
