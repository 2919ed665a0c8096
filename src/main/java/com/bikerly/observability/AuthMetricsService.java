package com.bikerly.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Micrometer-backed auth metrics.
 * Only active when app.metrics.enabled=true (the default).
 *
 * Metrics:
 * - bikerly.auth.login: Counter tagged outcome=success|failure and reason
 * - bikerly.auth.registration: Counter of created accounts
 * - bikerly.ratelimit.rejected: Counter tagged by scope (global, register, login)
 * - bikerly.auth.denied: Counter of auth gate rejections tagged by reason
 */
@Service
@ConditionalOnProperty(name = "app.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class AuthMetricsService implements AuthMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(AuthMetricsService.class);
    private static final String SERVICE_TAG = "bikerly-api";

    private final MeterRegistry meterRegistry;
    private final Counter loginSuccessCounter;
    private final Counter registrationCounter;

    public AuthMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.loginSuccessCounter = Counter.builder("bikerly.auth.login")
                .description("Login attempts")
                .tag("service", SERVICE_TAG)
                .tag("outcome", "success")
                .tag("reason", "none")
                .register(meterRegistry);
        this.registrationCounter = Counter.builder("bikerly.auth.registration")
                .description("Accounts created through registration")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
        logger.info("Auth metrics service initialized");
    }

    @Override
    public void recordLoginSuccess() {
        loginSuccessCounter.increment();
    }

    @Override
    public void recordLoginFailure(String reason) {
        Counter.builder("bikerly.auth.login")
                .description("Login attempts")
                .tag("service", SERVICE_TAG)
                .tag("outcome", "failure")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordRegistration() {
        registrationCounter.increment();
    }

    @Override
    public void recordRateLimitRejection(String scope) {
        Counter.builder("bikerly.ratelimit.rejected")
                .description("Requests rejected by the rate limiter")
                .tag("service", SERVICE_TAG)
                .tag("scope", scope)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordAccessDenied(String reason) {
        Counter.builder("bikerly.auth.denied")
                .description("Requests rejected by the auth gate")
                .tag("service", SERVICE_TAG)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
