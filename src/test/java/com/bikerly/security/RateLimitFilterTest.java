package com.bikerly.security;

import com.bikerly.observability.AuthMetricsServiceStub;
import com.bikerly.util.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the global rate limit filter.
 */
class RateLimitFilterTest {

    private static final int LIMIT = 3;
    private static final int REGISTER_LIMIT = 2;
    private static final int LOGIN_LIMIT = 2;

    private MutableClock clock;
    private RateLimitFilter filter;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
        objectMapper = Jackson2ObjectMapperBuilder.json()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();
        AuthMetricsServiceStub metrics = new AuthMetricsServiceStub();
        filter = new RateLimitFilter(new RateLimitService(clock), metrics, objectMapper,
                LIMIT, 60, REGISTER_LIMIT, 60, LOGIN_LIMIT, 60);
    }

    @Test
    void testRequestsWithinLimitPassThrough() throws Exception {
        for (int i = 0; i < LIMIT; i++) {
            MockFilterChain chain = new MockFilterChain();
            MockHttpServletResponse response = new MockHttpServletResponse();

            filter.doFilter(request("/api/users/me", "10.0.0.1"), response, chain);

            assertThat(chain.getRequest()).isNotNull();
            assertThat(response.getStatus()).isEqualTo(200);
        }
    }

    @Test
    void testRequestOverLimitGets429WithRetryAfter() throws Exception {
        for (int i = 0; i < LIMIT; i++) {
            filter.doFilter(request("/api/users/me", "10.0.0.2"), new MockHttpServletResponse(), new MockFilterChain());
        }
        clock.advanceSeconds(20);

        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request("/api/users/me", "10.0.0.2"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("40");
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("error").asBoolean()).isTrue();
        assertThat(body.get("error_code").asText()).isEqualTo("RATE_LIMIT_ERROR");
        assertThat(body.get("retry_after").asInt()).isEqualTo(40);
        assertThat(body.get("path").asText()).isEqualTo("/api/users/me");
    }

    @Test
    void testClientsAreLimitedIndependently() throws Exception {
        for (int i = 0; i < LIMIT; i++) {
            filter.doFilter(request("/api/users/me", "10.0.0.3"), new MockHttpServletResponse(), new MockFilterChain());
        }

        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request("/api/users/me", "10.0.0.4"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void testExemptPathsAreNeverLimited() throws Exception {
        for (int i = 0; i < LIMIT * 3; i++) {
            MockFilterChain chain = new MockFilterChain();
            MockHttpServletResponse response = new MockHttpServletResponse();

            filter.doFilter(request("/health", "10.0.0.5"), response, chain);

            assertThat(chain.getRequest()).isNotNull();
        }
    }

    @Test
    void testExemptPathMatching() {
        assertThat(RateLimitFilter.isExemptPath("/")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/health")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/docs")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/redoc")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/openapi.json")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/swagger-ui/index.html")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/v3/api-docs")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/actuator/health")).isTrue();
        assertThat(RateLimitFilter.isExemptPath("/actuator/metrics")).isFalse();

        // "/" is exact, not a prefix of everything
        assertThat(RateLimitFilter.isExemptPath("/api/auth/login")).isFalse();
        assertThat(RateLimitFilter.isExemptPath("/api/users/me")).isFalse();
    }

    @Test
    void testRegisterLimitCountsRequestsBeforeBodyIsRead() throws Exception {
        for (int i = 0; i < REGISTER_LIMIT; i++) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(post("/api/auth/register", "10.0.0.6", "{}"), new MockHttpServletResponse(), chain);
            assertThat(chain.getRequest()).isNotNull();
        }

        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(post("/api/auth/register", "10.0.0.6", "{}"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("60");
        assertThat(objectMapper.readTree(response.getContentAsString()).get("path").asText())
                .isEqualTo("/api/auth/register");
    }

    @Test
    void testLoginLimitIndependentOfRegisterLimit() throws Exception {
        for (int i = 0; i < REGISTER_LIMIT; i++) {
            filter.doFilter(post("/api/auth/register", "10.0.0.7", "{}"), new MockHttpServletResponse(), new MockFilterChain());
        }

        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(post("/api/auth/login", "10.0.0.7", ""), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    private static MockHttpServletRequest post(String path, String forwardedFor, String body) {
        MockHttpServletRequest request = request(path, forwardedFor);
        request.setMethod("POST");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));
        return request;
    }

    private static MockHttpServletRequest request(String path, String forwardedFor) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        request.addHeader("X-Forwarded-For", forwardedFor);
        request.addHeader("User-Agent", "test-agent");
        return request;
    }
}
