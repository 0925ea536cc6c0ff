package portico.core.service.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.ratelimit.RateLimitDecision;
import portico.core.model.ratelimit.RateLimitKey;
import portico.core.model.ratelimit.RateLimitOutcome;
import portico.core.model.ratelimit.RateLimitPolicies;
import portico.core.model.ratelimit.RateLimitPolicy;
import portico.core.model.ratelimit.StoreFailureMode;
import portico.core.port.out.Metrics;
import portico.core.port.out.RateLimiter;

/**
 * Applies fixed-window limits per client and route group.
 *
 * <p>Counters are incremented before comparing, so the request that pushes a counter
 * past the maximum is the one rejected. When the counter store fails, the group's
 * {@link StoreFailureMode} decides whether the request proceeds uncounted or is refused.
 *
 * <p>A configured global group is counted for every route ahead of the route's own group.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    static final String FEATURE = "rate-limiting";

    private final RateLimiter rateLimiter;
    private final RateLimitPolicies policies;
    private final Clock clock;
    private final Metrics metrics;

    @Inject
    public RateLimitService(RateLimiter rateLimiter, RateLimitPolicies policies, Clock clock, Metrics metrics) {
        this.rateLimiter = rateLimiter;
        this.policies = policies;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Count a routed request against the global group, if any, and then its route's group.
     *
     * <p>The route group is only counted once the global group allows the request. The
     * returned decision is the route group's.
     *
     * @param routeGroup the route's rate limit group
     * @param clientId   the client identifier
     * @return the first outcome that is not allowed, or the route group's outcome; never a failed Uni
     */
    public Uni<RateLimitOutcome> checkRoute(String routeGroup, String clientId) {
        var global = policies.enabled() ? policies.global().orElse(null) : null;
        if (global == null || global.group().equals(routeGroup)) {
            return check(routeGroup, clientId);
        }
        return check(global.group(), clientId).flatMap(outcome -> {
            if (outcome instanceof RateLimitOutcome.Allowed) {
                return check(routeGroup, clientId);
            }
            return Uni.createFrom().item(outcome);
        });
    }

    /**
     * Count a request against a group's limit.
     *
     * @param group    the route's rate limit group
     * @param clientId the client identifier
     * @return the outcome; never a failed Uni
     */
    public Uni<RateLimitOutcome> check(String group, String clientId) {
        if (!policies.enabled()) {
            return Uni.createFrom().item(new RateLimitOutcome.Allowed(null));
        }

        var policy = policies.forGroup(group)
                .orElseThrow(() -> new IllegalStateException("No rate limit group named " + group));
        var key = new RateLimitKey(group, clientId);

        return rateLimiter
                .increment(key, policy.window())
                .map(count -> evaluate(key, policy, RateLimitDecision.evaluate(count, policy, clock.instant())))
                .onFailure()
                .recoverWithItem(error -> onStoreFailure(key, policy, error));
    }

    private RateLimitOutcome evaluate(RateLimitKey key, RateLimitPolicy policy, RateLimitDecision decision) {
        if (decision.allowed()) {
            return new RateLimitOutcome.Allowed(decision);
        }
        LOG.debugf(
                "Rate limit exceeded for %s (count=%d, limit=%d, retryAfter=%ds)",
                key.toCacheKey(), decision.requestCount(), decision.limit(), decision.retryAfterSeconds());
        metrics.recordRateLimitExceeded(policy.group());
        return new RateLimitOutcome.Exceeded(policy.group(), decision);
    }

    private RateLimitOutcome onStoreFailure(RateLimitKey key, RateLimitPolicy policy, Throwable error) {
        metrics.recordStoreFailure(FEATURE, "increment");
        if (policy.onStoreFailure() == StoreFailureMode.FAIL_OPEN) {
            LOG.warnv(
                    "Rate limit store failed for group {0}, allowing request uncounted: {1}",
                    policy.group(), error.getMessage());
            return new RateLimitOutcome.Allowed(null);
        }
        LOG.warnv(
                "Rate limit store failed for group {0}, rejecting request for {1}: {2}",
                policy.group(), key.clientId(), error.getMessage());
        return new RateLimitOutcome.StoreUnavailable(policy.group());
    }
}
