package com.hwsc.userservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Account-domain exceptions (lookup, uniqueness, credentials).
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 – No account with the given id or email. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(StatusCode.NOT_FOUND, HttpStatus.NOT_FOUND,
                    "user-not-found",
                    "User Not Found",
                    detail);
        }
    }

    /** 409 – Email already committed by, or pending for, another account. */
    public static final class EmailAlreadyInUse extends ApiException {
        public EmailAlreadyInUse(String email) {
            super(StatusCode.ALREADY_EXISTS, HttpStatus.CONFLICT,
                    "email-already-in-use",
                    "Email Already In Use",
                    "email '" + email + "' is already taken");
        }
    }

    /** 401 – Email/password pair does not match the stored account. */
    public static final class CredentialsMismatch extends ApiException {
        public CredentialsMismatch() {
            super(StatusCode.UNAUTHENTICATED, HttpStatus.UNAUTHORIZED,
                    "credentials-mismatch",
                    "Unauthenticated",
                    "email or password does not match");
        }
    }
}
