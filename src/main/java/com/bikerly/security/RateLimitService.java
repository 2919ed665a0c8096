package com.bikerly.security;

import com.bikerly.util.Strings;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory sliding-window log rate limiter.
 *
 * <p>Keeps the exact timestamps of admitted requests per client identity. Each check prunes,
 * counts and appends inside one {@link ConcurrentMap#compute} call, so concurrent requests for the
 * same identity cannot both take the last slot. Rejected attempts are not recorded.
 *
 * <p>Every {@link #CLEANUP_INTERVAL} the first request to arrive also sweeps the whole map,
 * dropping timestamps older than {@link #CLEANUP_RETENTION} and identities left with none.
 * State is process-local and lost on restart.
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    static final Duration CLEANUP_INTERVAL = Duration.ofMinutes(5);
    static final Duration CLEANUP_RETENTION = Duration.ofHours(1);
    static final int USER_AGENT_MAX_LENGTH = 50;

    private final ConcurrentMap<String, Deque<Instant>> requestLog = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastCleanup;
    private final Clock clock;

    public RateLimitService(Clock clock) {
        this.clock = clock;
        this.lastCleanup = new AtomicReference<>(clock.instant());
    }

    /**
     * Checks whether a request from the identifier fits in the window, recording it if so.
     *
     * @param identifier client identity key
     * @param maxRequests maximum admitted requests per window
     * @param windowSeconds window length in seconds
     * @return allowed, or rejected with the seconds until a slot frees up
     */
    public RateLimitDecision isAllowed(String identifier, int maxRequests, int windowSeconds) {
        cleanupIfDue();

        RateLimitDecision[] decision = new RateLimitDecision[1];
        requestLog.compute(identifier, (key, existing) -> {
            Deque<Instant> timestamps = existing != null ? existing : new ArrayDeque<>();
            Instant now = clock.instant();
            prune(timestamps, now.minusSeconds(windowSeconds));

            if (timestamps.size() >= maxRequests) {
                decision[0] = RateLimitDecision.rejected(retryAfter(timestamps.peekFirst(), windowSeconds, now));
            } else {
                timestamps.addLast(now);
                decision[0] = RateLimitDecision.allowed();
            }
            return timestamps.isEmpty() ? null : timestamps;
        });
        return decision[0];
    }

    /**
     * Key for an endpoint-specific window. The scope prefix keeps it apart from the global window
     * for the same client, so one request never spends the same window twice.
     */
    public static String scopedKey(String scope, String identity) {
        return scope + "|" + identity;
    }

    /**
     * Extracts client IP address from request, handling X-Forwarded-For header.
     * Returns the left-most IP (original client) if present, else remote address.
     */
    public String extractClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            // X-Forwarded-For can contain multiple IPs: "client, proxy1, proxy2"
            String first = xForwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return Strings.safe(request.getRemoteAddr());
    }

    /**
     * Client identity key: client IP plus the first 50 characters of the User-Agent.
     * Clients behind one NAT or proxy with the same agent share a key.
     */
    public String resolveClientIdentity(HttpServletRequest request) {
        String userAgent = Strings.truncate(request.getHeader("User-Agent"), USER_AGENT_MAX_LENGTH);
        return extractClientIp(request) + ":" + userAgent;
    }

    /**
     * Number of identities currently holding timestamps. Used for monitoring and tests.
     */
    public int getTrackedIdentityCount() {
        return requestLog.size();
    }

    void cleanupIfDue() {
        Instant now = clock.instant();
        Instant last = lastCleanup.get();
        if (Duration.between(last, now).compareTo(CLEANUP_INTERVAL) < 0) {
            return;
        }
        // Only the request that wins the swap runs the sweep
        if (!lastCleanup.compareAndSet(last, now)) {
            return;
        }

        Instant cutoff = now.minus(CLEANUP_RETENTION);
        int before = requestLog.size();
        for (String key : requestLog.keySet()) {
            requestLog.computeIfPresent(key, (k, timestamps) -> {
                prune(timestamps, cutoff);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        logger.debug("Rate limiter cleanup: identities {} -> {}", before, requestLog.size());
    }

    private static void prune(Deque<Instant> timestamps, Instant cutoff) {
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }

    private static int retryAfter(Instant oldest, int windowSeconds, Instant now) {
        if (oldest == null) {
            return Math.max(1, windowSeconds);
        }
        long seconds = Duration.between(now, oldest.plusSeconds(windowSeconds)).getSeconds();
        return (int) Math.max(1, seconds);
    }
}
