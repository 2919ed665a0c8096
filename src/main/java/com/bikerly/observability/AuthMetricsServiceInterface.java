package com.bikerly.observability;

/**
 * Interface for auth metrics to support both enabled and disabled modes.
 */
public interface AuthMetricsServiceInterface {
    void recordLoginSuccess();
    void recordLoginFailure(String reason);
    void recordRegistration();
    void recordRateLimitRejection(String scope);
    void recordAccessDenied(String reason);
}
