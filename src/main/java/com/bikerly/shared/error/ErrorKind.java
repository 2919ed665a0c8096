package com.bikerly.shared.error;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds surfaced to callers, with the fixed HTTP status and machine code each maps to.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR"),
    REQUEST_VALIDATION(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR"),
    AUTHENTICATION(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_ERROR"),
    AUTHORIZATION(HttpStatus.FORBIDDEN, "AUTHORIZATION_ERROR"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND"),
    CONFLICT(HttpStatus.CONFLICT, "CONFLICT_ERROR"),
    RATE_LIMIT(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMIT_ERROR"),
    DATABASE(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR"),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR");

    private final HttpStatus status;
    private final String code;

    ErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
