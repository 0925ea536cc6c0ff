package portico.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check, indicating whether a request is allowed and
 * providing information about the current window.
 *
 * @param allowed           whether the request is allowed
 * @param remaining         requests remaining in the current window
 * @param limit             the maximum for the window
 * @param windowSeconds     the window duration in seconds
 * @param resetAt           when the current window expires
 * @param retryAfterSeconds seconds until the client can retry (only meaningful when not allowed)
 * @param requestCount      requests counted in the current window
 */
public record RateLimitDecision(
        boolean allowed,
        long remaining,
        long limit,
        long windowSeconds,
        Instant resetAt,
        long retryAfterSeconds,
        long requestCount) {

    /**
     * Evaluate a counter against a policy.
     *
     * <p>A request is allowed while the post-increment count is at most the maximum.
     */
    public static RateLimitDecision evaluate(WindowCount count, RateLimitPolicy policy, Instant now) {
        var millisUntilReset = Math.max(0, count.millisUntilReset());
        var resetAt = now.plusMillis(millisUntilReset);
        var limit = policy.maxRequests();
        if (count.count() <= limit) {
            return new RateLimitDecision(
                    true, limit - count.count(), limit, policy.windowSeconds(), resetAt, 0, count.count());
        }
        var retryAfter = Math.max(1, (millisUntilReset + 999) / 1000);
        return new RateLimitDecision(false, 0, limit, policy.windowSeconds(), resetAt, retryAfter, count.count());
    }

    /**
     * Return the reset time as epoch seconds for response headers.
     */
    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
