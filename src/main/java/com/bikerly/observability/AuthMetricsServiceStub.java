package com.bikerly.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Stub implementation when metrics are disabled.
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "false")
public class AuthMetricsServiceStub implements AuthMetricsServiceInterface {

    @Override
    public void recordLoginSuccess() {
        // No-op when metrics are disabled
    }

    @Override
    public void recordLoginFailure(String reason) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordRegistration() {
        // No-op when metrics are disabled
    }

    @Override
    public void recordRateLimitRejection(String scope) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordAccessDenied(String reason) {
        // No-op when metrics are disabled
    }
}
