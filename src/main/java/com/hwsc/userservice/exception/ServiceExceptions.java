package com.hwsc.userservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures of the service itself or of the dependencies it calls into.
 */
public final class ServiceExceptions {

    private ServiceExceptions() {}

    /** 503 – Service administratively locked, or the relational store is unreachable. */
    public static final class Unavailable extends ApiException {
        public Unavailable(String detail) {
            super(StatusCode.UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE,
                    "service-unavailable",
                    "Service Unavailable",
                    detail);
        }
    }

    /** 500 – Unexpected store, mail or hashing failure. */
    public static final class Internal extends ApiException {
        public Internal(String detail, Throwable cause) {
            super(StatusCode.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR,
                    "internal-error",
                    "Internal Server Error",
                    detail,
                    cause);
        }
    }
}
