package portico.core.model.gateway;

import java.util.Objects;
import java.util.Optional;

import portico.core.model.auth.AuthContext;
import portico.core.model.ratelimit.RateLimitDecision;
import portico.core.model.routing.RouteMatch;

/**
 * Per-request state threaded through the gateway pipeline.
 *
 * <p>Each stage returns a new exchange rather than mutating this one.
 */
public record GatewayExchange(
        GatewayRequest request,
        Optional<RouteMatch> routeMatch,
        Optional<RateLimitDecision> rateLimitDecision,
        Optional<AuthContext> authContext) {

    public GatewayExchange {
        Objects.requireNonNull(request, "request must not be null");
        routeMatch = Objects.requireNonNullElse(routeMatch, Optional.empty());
        rateLimitDecision = Objects.requireNonNullElse(rateLimitDecision, Optional.empty());
        authContext = Objects.requireNonNullElse(authContext, Optional.empty());
    }

    public static GatewayExchange start(GatewayRequest request) {
        return new GatewayExchange(request, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public GatewayExchange withRouteMatch(RouteMatch match) {
        return new GatewayExchange(request, Optional.of(match), rateLimitDecision, authContext);
    }

    public GatewayExchange withRateLimitDecision(RateLimitDecision decision) {
        return new GatewayExchange(request, routeMatch, Optional.ofNullable(decision), authContext);
    }

    public GatewayExchange withAuthContext(AuthContext context) {
        return new GatewayExchange(request, routeMatch, rateLimitDecision, Optional.of(context));
    }

    /**
     * The matched route; stages after route matching may rely on it being present.
     *
     * @throws IllegalStateException if no route has been matched yet
     */
    public RouteMatch requireRouteMatch() {
        return routeMatch.orElseThrow(() -> new IllegalStateException("Route has not been matched"));
    }
}
