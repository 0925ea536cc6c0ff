package portico.core.service.ratelimit;

import java.util.LinkedHashMap;
import java.util.Map;

import portico.core.model.ratelimit.RateLimitDecision;

/**
 * Standard rate limit response headers.
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    private RateLimitHeaders() {}

    /**
     * Headers describing a decision; {@code Retry-After} is only included for rejections.
     */
    public static Map<String, String> of(RateLimitDecision decision) {
        var headers = new LinkedHashMap<String, String>();
        headers.put(LIMIT, String.valueOf(decision.limit()));
        headers.put(REMAINING, String.valueOf(decision.remaining()));
        headers.put(RESET, String.valueOf(decision.resetAtEpochSeconds()));
        if (!decision.allowed()) {
            headers.put(RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        }
        return headers;
    }
}
