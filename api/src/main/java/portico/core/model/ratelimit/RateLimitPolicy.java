package portico.core.model.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed window limit applied to one route group.
 *
 * @param group          group name (e.g. {@code auth}, {@code general})
 * @param window         window length, measured from the first request of the window
 * @param maxRequests    requests allowed per client within a window
 * @param onStoreFailure behaviour when the counter store is unavailable
 */
public record RateLimitPolicy(String group, Duration window, long maxRequests, StoreFailureMode onStoreFailure) {

    public RateLimitPolicy {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(onStoreFailure, "onStoreFailure must not be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Rate limit window must be positive for group " + group);
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("Rate limit max-requests must be at least 1 for group " + group);
        }
    }

    public long windowSeconds() {
        return Math.max(1, window.toSeconds());
    }
}
