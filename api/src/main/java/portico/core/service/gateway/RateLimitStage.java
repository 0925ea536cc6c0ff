package portico.core.service.gateway;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.GatewayExchange;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.StageOutcome;
import portico.core.model.ratelimit.RateLimitOutcome;
import portico.core.service.common.ClientIpExtractor;
import portico.core.service.ratelimit.RateLimitService;

/**
 * Counts the request against its route's rate limit group.
 *
 * <p>Runs before authentication so that rejected floods never reach token verification.
 */
@ApplicationScoped
public class RateLimitStage implements GatewayStage {

    static final String FEATURE = "rate-limiting";

    private final RateLimitService rateLimitService;
    private final ClientIpExtractor clientIpExtractor;

    @Inject
    public RateLimitStage(RateLimitService rateLimitService, ClientIpExtractor clientIpExtractor) {
        this.rateLimitService = rateLimitService;
        this.clientIpExtractor = clientIpExtractor;
    }

    @Override
    public Uni<StageOutcome> apply(GatewayExchange exchange) {
        var group = exchange.requireRouteMatch().route().rateLimitGroup();
        var clientId = clientIpExtractor.extract(exchange.request());

        return rateLimitService.checkRoute(group, clientId).map(outcome -> {
            if (outcome instanceof RateLimitOutcome.Exceeded exceeded) {
                return StageOutcome.halt(new GatewayResult.RateLimited(exceeded.group(), exceeded.decision()));
            }
            if (outcome instanceof RateLimitOutcome.StoreUnavailable) {
                return StageOutcome.halt(new GatewayResult.StoreUnavailable(FEATURE));
            }
            var allowed = (RateLimitOutcome.Allowed) outcome;
            return StageOutcome.proceed(exchange.withRateLimitDecision(allowed.decision()));
        });
    }

    @Override
    public String name() {
        return "rate-limit";
    }
}
