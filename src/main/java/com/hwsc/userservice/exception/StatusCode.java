package com.hwsc.userservice.exception;

/**
 * Stable, machine-readable outcome codes returned with every response.
 * Clients switch on these; the HTTP status is derived from them.
 */
public enum StatusCode {
    OK,
    INVALID_ARGUMENT,
    NOT_FOUND,
    UNAUTHENTICATED,
    ALREADY_EXISTS,
    DEADLINE_EXCEEDED,
    UNAVAILABLE,
    INTERNAL
}
