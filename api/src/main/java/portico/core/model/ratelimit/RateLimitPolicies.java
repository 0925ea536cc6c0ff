package portico.core.model.ratelimit;

import java.util.Map;
import java.util.Optional;

/**
 * All configured rate limit groups.
 *
 * @param enabled     whether rate limiting is applied at all
 * @param groups      policies keyed by group name
 * @param globalGroup name of a group counted for every route before the route's own group, may be null
 */
public record RateLimitPolicies(boolean enabled, Map<String, RateLimitPolicy> groups, String globalGroup) {

    public RateLimitPolicies {
        groups = groups == null ? Map.of() : Map.copyOf(groups);
        if (globalGroup != null && !groups.containsKey(globalGroup)) {
            throw new IllegalArgumentException("Unknown global rate limit group: " + globalGroup);
        }
    }

    public RateLimitPolicies(boolean enabled, Map<String, RateLimitPolicy> groups) {
        this(enabled, groups, null);
    }

    public Optional<RateLimitPolicy> forGroup(String group) {
        return Optional.ofNullable(groups.get(group));
    }

    public Optional<RateLimitPolicy> global() {
        return globalGroup == null ? Optional.empty() : forGroup(globalGroup);
    }
}
