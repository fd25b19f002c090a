package com.hwsc.userservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying the outcome code plus HTTP semantics for RFC 7807 responses.
 * Throw these from services; GlobalExceptionHandler maps them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    protected static final String PROBLEM_BASE = "https://hwsc.org/problems/";

    private final StatusCode code;
    private final HttpStatus status;
    private final String type;   // e.g., https://hwsc.org/problems/account-not-found
    private final String title;  // short summary for ProblemDetail title

    protected ApiException(StatusCode code, HttpStatus status, String slug, String title, String detail) {
        super(detail);
        this.code = code;
        this.status = status;
        this.type = PROBLEM_BASE + slug;
        this.title = title;
    }

    protected ApiException(StatusCode code, HttpStatus status, String slug, String title, String detail,
                           Throwable cause) {
        super(detail, cause);
        this.code = code;
        this.status = status;
        this.type = PROBLEM_BASE + slug;
        this.title = title;
    }
}
