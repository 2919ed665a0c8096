package com.bikerly.shared.error;

/**
 * Failure raised by the auth core and mapped to a response by {@link ErrorKind}.
 * The message and detail are safe to show to callers; internal causes are logged where they occur.
 */
public class ApiException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;
    private final Integer retryAfterSeconds;

    public ApiException(ErrorKind kind, String message, String detail) {
        this(kind, message, detail, null, null);
    }

    public ApiException(ErrorKind kind, String message, String detail, Integer retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.detail = detail != null ? detail : message;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static ApiException validation(String message, String detail) {
        return new ApiException(ErrorKind.VALIDATION, message, detail);
    }

    public static ApiException authentication(String message, String detail) {
        return new ApiException(ErrorKind.AUTHENTICATION, message, detail != null ? detail : "Invalid credentials");
    }

    public static ApiException authorization(String message, String detail) {
        return new ApiException(ErrorKind.AUTHORIZATION, message, detail != null ? detail : "Insufficient permissions");
    }

    public static ApiException conflict(String message, String detail) {
        return new ApiException(ErrorKind.CONFLICT, message, detail);
    }

    public static ApiException database(String message, String detail, Throwable cause) {
        return new ApiException(ErrorKind.DATABASE, message, detail, null, cause);
    }

    public static ApiException rateLimited(int retryAfterSeconds) {
        return new ApiException(ErrorKind.RATE_LIMIT, "Rate limit exceeded",
                "Rate limit exceeded. Retry after " + retryAfterSeconds + " seconds",
                retryAfterSeconds, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }

    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
