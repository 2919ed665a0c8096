package com.bikerly.config;

import com.bikerly.shared.dto.ErrorResponse;
import com.bikerly.shared.error.ApiException;
import com.bikerly.shared.error.ErrorKind;
import com.bikerly.util.CorrelationIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to error payloads through the {@link ErrorKind} table.
 * Callers only ever see the safe message and detail; raw exception text stays in the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex, HttpServletRequest request) {
        if (ex.getKind().getStatus().is5xxServerError()) {
            logger.error("Application error: {} (error_code={}, path={}, method={})",
                    ex.getMessage(), ex.getKind().getCode(), request.getRequestURI(), request.getMethod());
        } else {
            logger.warn("Application error: {} (error_code={}, path={}, method={})",
                    ex.getMessage(), ex.getKind().getCode(), request.getRequestURI(), request.getMethod());
        }

        ErrorResponse body = ErrorResponse.of(ex.getKind(), ex.getMessage(), ex.getDetail(),
                request.getRequestURI(), traceId());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(ex.getKind().getStatus());

        if (ex.getKind() == ErrorKind.RATE_LIMIT && ex.getRetryAfterSeconds() != null) {
            body.setRetryAfter(ex.getRetryAfterSeconds());
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        }
        if (ex.getKind() == ErrorKind.AUTHENTICATION) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return builder.body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                   HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        logger.warn("Validation error: path={}, errors={}", request.getRequestURI(), errors.keySet());

        ErrorResponse body = ErrorResponse.of(ErrorKind.REQUEST_VALIDATION, "Validation error",
                "Invalid request data", request.getRequestURI(), traceId());
        body.setErrors(errors);
        return ResponseEntity.status(ErrorKind.REQUEST_VALIDATION.getStatus()).body(body);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex, HttpServletRequest request) {
        logger.warn("Unreadable request: path={}, reason={}", request.getRequestURI(), ex.getClass().getSimpleName());
        ErrorResponse body = ErrorResponse.of(ErrorKind.REQUEST_VALIDATION, "Validation error",
                "Invalid request data", request.getRequestURI(), traceId());
        if (ex instanceof MissingServletRequestParameterException) {
            MissingServletRequestParameterException missing = (MissingServletRequestParameterException) ex;
            body.setErrors(Map.of(missing.getParameterName(), "is required"));
        }
        return ResponseEntity.status(ErrorKind.REQUEST_VALIDATION.getStatus()).body(body);
    }

    @ExceptionHandler({NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleHttpException(Exception ex, HttpServletRequest request) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        logger.warn("HTTP exception: status={}, path={}, method={}",
                status.value(), request.getRequestURI(), request.getMethod());
        ErrorResponse body = new ErrorResponse("HTTP_ERROR", ex.getMessage(), ex.getMessage(),
                request.getRequestURI(), traceId());
        if (status.value() == ErrorKind.NOT_FOUND.getStatus().value()) {
            body = ErrorResponse.of(ErrorKind.NOT_FOUND, "Not found", "No resource at this path",
                    request.getRequestURI(), traceId());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseException(DataAccessException ex, HttpServletRequest request) {
        logger.error("Database error: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
        ErrorResponse body = ErrorResponse.of(ErrorKind.DATABASE, "Database operation failed",
                "An error occurred while processing your request", request.getRequestURI(), traceId());
        return ResponseEntity.status(ErrorKind.DATABASE.getStatus()).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
        ErrorResponse body = ErrorResponse.of(ErrorKind.INTERNAL, "Internal server error",
                "An unexpected error occurred", request.getRequestURI(), traceId());
        return ResponseEntity.status(ErrorKind.INTERNAL.getStatus()).body(body);
    }

    private static String traceId() {
        return MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
    }
}
