package com.bikerly.security;

/**
 * Outcome of a single rate-limit evaluation.
 */
public final class RateLimitDecision {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, 0);

    private final boolean allowed;
    private final int retryAfterSeconds;

    private RateLimitDecision(boolean allowed, int retryAfterSeconds) {
        this.allowed = allowed;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RateLimitDecision allowed() {
        return ALLOWED;
    }

    public static RateLimitDecision rejected(int retryAfterSeconds) {
        return new RateLimitDecision(false, retryAfterSeconds);
    }

    public boolean isAllowed() {
        return allowed;
    }

    /**
     * Seconds until the oldest counted request leaves the window; 0 when allowed, at least 1 otherwise.
     */
    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public String toString() {
        return allowed ? "RateLimitDecision{allowed}" : "RateLimitDecision{rejected, retryAfter=" + retryAfterSeconds + "s}";
    }
}
