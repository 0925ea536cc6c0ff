package portico.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies one fixed-window counter: a client within a route group.
 *
 * <p>Key format: {@code portico:ratelimit:{group}:{clientId}}
 *
 * @param group    rate limit group name
 * @param clientId client identifier (normally the client IP)
 */
public record RateLimitKey(String group, String clientId) {

    private static final String KEY_PREFIX = "portico:ratelimit:";
    private static final String UNKNOWN_CLIENT = "unknown";

    public RateLimitKey {
        Objects.requireNonNull(group, "group must not be null");
        if (clientId == null || clientId.isBlank()) {
            clientId = UNKNOWN_CLIENT;
        }
    }

    public String toCacheKey() {
        return KEY_PREFIX + group + ":" + clientId;
    }
}
