package com.hwsc.userservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Auth-token and email-token failures.
 */
public final class TokenExceptions {

    private TokenExceptions() {}

    /** 404 – Auth token verification called without a token. */
    public static final class MissingAuthToken extends ApiException {
        public MissingAuthToken() {
            super(StatusCode.NOT_FOUND, HttpStatus.NOT_FOUND,
                    "missing-auth-token",
                    "Auth Token Not Found",
                    "no auth token supplied");
        }
    }

    /** 401 – No stored auth token matches, or its secret has been superseded. */
    public static final class AuthTokenRejected extends ApiException {
        public AuthTokenRejected(String detail) {
            super(StatusCode.UNAUTHENTICATED, HttpStatus.UNAUTHORIZED,
                    "auth-token-rejected",
                    "Unauthenticated",
                    detail);
        }
    }

    /** 404 – No email token row matches. */
    public static final class EmailTokenNotFound extends ApiException {
        public EmailTokenNotFound() {
            super(StatusCode.NOT_FOUND, HttpStatus.NOT_FOUND,
                    "email-token-not-found",
                    "Email Token Not Found",
                    "no matching email token found");
        }
    }

    /** 410 – Email token used after its expiration; the pending change has been discarded. */
    public static final class EmailTokenExpired extends ApiException {
        public EmailTokenExpired() {
            super(StatusCode.DEADLINE_EXCEEDED, HttpStatus.GONE,
                    "email-token-expired",
                    "Email Token Expired",
                    "email token has expired");
        }
    }
}
