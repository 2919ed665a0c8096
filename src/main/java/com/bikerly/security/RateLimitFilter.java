package com.bikerly.security;

import com.bikerly.observability.AuthMetricsServiceInterface;
import com.bikerly.shared.dto.ErrorResponse;
import com.bikerly.shared.error.ErrorKind;
import com.bikerly.util.CorrelationIdFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Filter that applies the global rate limit to every non-exempt path, then the endpoint limit for
 * register and login. Both run before the request body or form is read, so malformed requests count.
 * Rejections get a 429 JSON error with retry_after and a Retry-After header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String GLOBAL_SCOPE = "global";
    static final String REGISTER_PATH = "/api/auth/register";
    static final String LOGIN_PATH = "/api/auth/login";

    // Liveness and API docs; "/" is matched exactly, the rest as prefixes
    private static final List<String> EXEMPT_PREFIXES = List.of(
        "/health",
        "/docs",
        "/redoc",
        "/openapi.json",
        "/swagger-ui",
        "/v3/api-docs",
        "/actuator/health"
    );

    private final RateLimitService rateLimitService;
    private final AuthMetricsServiceInterface metricsService;
    private final ObjectMapper objectMapper;
    private final WindowLimit globalLimit;
    // path -> limit, matched exactly
    private final Map<String, WindowLimit> endpointLimits;

    public RateLimitFilter(
            RateLimitService rateLimitService,
            AuthMetricsServiceInterface metricsService,
            ObjectMapper objectMapper,
            @Value("${app.rate-limit.calls:100}") int maxRequests,
            @Value("${app.rate-limit.period-seconds:60}") int windowSeconds,
            @Value("${app.rate-limit.register.max-requests:5}") int registerMaxRequests,
            @Value("${app.rate-limit.register.window-seconds:60}") int registerWindowSeconds,
            @Value("${app.rate-limit.login.max-requests:10}") int loginMaxRequests,
            @Value("${app.rate-limit.login.window-seconds:60}") int loginWindowSeconds) {
        this.rateLimitService = rateLimitService;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.globalLimit = new WindowLimit(GLOBAL_SCOPE, maxRequests, windowSeconds);
        this.endpointLimits = Map.of(
            REGISTER_PATH, new WindowLimit("register", registerMaxRequests, registerWindowSeconds),
            LOGIN_PATH, new WindowLimit("login", loginMaxRequests, loginWindowSeconds)
        );
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return isExemptPath(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String identity = rateLimitService.resolveClientIdentity(request);
        if (!admit(globalLimit, identity, identity, request, response)) {
            return;
        }

        WindowLimit endpointLimit = endpointLimits.get(request.getRequestURI());
        if (endpointLimit != null
                && !admit(endpointLimit, RateLimitService.scopedKey(endpointLimit.scope, identity), identity,
                        request, response)) {
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean admit(WindowLimit limit, String key, String identity,
                          HttpServletRequest request, HttpServletResponse response) throws IOException {
        RateLimitDecision decision = rateLimitService.isAllowed(key, limit.maxRequests, limit.windowSeconds);
        if (decision.isAllowed()) {
            return true;
        }
        logger.warn("Rate limit exceeded: scope={}, client={}, path={}, method={}, retryAfter={}s",
                limit.scope, identity, request.getRequestURI(), request.getMethod(), decision.getRetryAfterSeconds());
        metricsService.recordRateLimitRejection(limit.scope);
        sendTooManyRequests(request, response, decision.getRetryAfterSeconds());
        return false;
    }

    static boolean isExemptPath(String path) {
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return true;
        }
        return EXEMPT_PREFIXES.stream().anyMatch(path::startsWith);
    }

    private void sendTooManyRequests(HttpServletRequest request, HttpServletResponse response, int retryAfter)
            throws IOException {
        ErrorResponse body = ErrorResponse.of(ErrorKind.RATE_LIMIT,
                "Rate limit exceeded",
                "Too many requests. Please try again after " + retryAfter + " seconds.",
                request.getRequestURI(),
                MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
        body.setRetryAfter(retryAfter);

        response.setStatus(ErrorKind.RATE_LIMIT.getStatus().value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), body);
    }

    private static final class WindowLimit {
        private final String scope;
        private final int maxRequests;
        private final int windowSeconds;

        private WindowLimit(String scope, int maxRequests, int windowSeconds) {
            this.scope = scope;
            this.maxRequests = maxRequests;
            this.windowSeconds = windowSeconds;
        }
    }
}
