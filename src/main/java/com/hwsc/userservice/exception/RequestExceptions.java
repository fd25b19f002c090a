package com.hwsc.userservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Problems with the incoming request itself. Raised before any side effect.
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 – Missing request body or identification. */
    public static final class NilRequest extends ApiException {
        public NilRequest(String what) {
            super(StatusCode.INVALID_ARGUMENT, HttpStatus.BAD_REQUEST,
                    "nil-request",
                    "Missing Request Data",
                    "nil request " + what);
        }
    }

    /** 400 – A field failed syntax validation (id, name, email, password, organization). */
    public static final class InvalidArgument extends ApiException {
        public InvalidArgument(String detail) {
            super(StatusCode.INVALID_ARGUMENT, HttpStatus.BAD_REQUEST,
                    "invalid-argument",
                    "Invalid Argument",
                    detail);
        }
    }
}
