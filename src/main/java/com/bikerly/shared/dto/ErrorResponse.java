package com.bikerly.shared.dto;

import com.bikerly.shared.error.ErrorKind;

import java.time.Instant;
import java.util.Map;

/**
 * Standard error response DTO. Serialized in snake_case (error_code, trace_id, retry_after).
 */
public class ErrorResponse {

    private final boolean error = true;
    private String errorCode;
    private String message;
    private String detail;
    private String path;
    private Instant timestamp;
    private String traceId;
    private Integer retryAfter;
    private Map<String, String> errors; // For validation errors

    public ErrorResponse() {
        this.timestamp = Instant.now();
    }

    public ErrorResponse(String errorCode, String message, String detail, String path, String traceId) {
        this.errorCode = errorCode;
        this.message = message;
        this.detail = detail;
        this.path = path;
        this.traceId = traceId;
        this.timestamp = Instant.now();
    }

    public static ErrorResponse of(ErrorKind kind, String message, String detail, String path, String traceId) {
        return new ErrorResponse(kind.getCode(), message, detail, path, traceId);
    }

    public boolean isError() {
        return error;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public Integer getRetryAfter() {
        return retryAfter;
    }

    public void setRetryAfter(Integer retryAfter) {
        this.retryAfter = retryAfter;
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    public void setErrors(Map<String, String> errors) {
        this.errors = errors;
    }
}
