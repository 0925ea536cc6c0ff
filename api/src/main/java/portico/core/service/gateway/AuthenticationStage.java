package portico.core.service.gateway;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import portico.core.model.auth.TokenValidationResult;
import portico.core.model.gateway.GatewayExchange;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.StageOutcome;
import portico.core.service.auth.TokenValidationService;

/**
 * Verifies the bearer token on routes that require authentication and attaches
 * the caller identity to the exchange.
 */
@ApplicationScoped
public class AuthenticationStage implements GatewayStage {

    static final String FEATURE = "token-revocation";

    private final TokenValidationService tokenValidationService;

    @Inject
    public AuthenticationStage(TokenValidationService tokenValidationService) {
        this.tokenValidationService = tokenValidationService;
    }

    @Override
    public Uni<StageOutcome> apply(GatewayExchange exchange) {
        var request = exchange.request();
        var route = exchange.requireRouteMatch().route();
        if (!route.access().requiresAuthentication(request.method())) {
            return Uni.createFrom().item(StageOutcome.proceed(exchange));
        }

        return tokenValidationService
                .validate(request.getHeaderString("Authorization"))
                .map(result -> {
                    if (result instanceof TokenValidationResult.Valid valid) {
                        return StageOutcome.proceed(exchange.withAuthContext(valid.context()));
                    }
                    if (result instanceof TokenValidationResult.Rejected rejected) {
                        return StageOutcome.halt(new GatewayResult.Unauthorized(rejected.reason(), rejected.detail()));
                    }
                    return StageOutcome.halt(new GatewayResult.StoreUnavailable(FEATURE));
                });
    }

    @Override
    public String name() {
        return "authentication";
    }
}
