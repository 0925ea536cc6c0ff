package portico.core.service.gateway;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.GatewayExchange;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.StageOutcome;
import portico.core.service.routing.RouteTable;

/**
 * Resolves the route for the request path.
 */
@ApplicationScoped
public class RouteMatchStage implements GatewayStage {

    private final RouteTable routeTable;

    @Inject
    public RouteMatchStage(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    @Override
    public Uni<StageOutcome> apply(GatewayExchange exchange) {
        var path = exchange.request().path();
        var outcome = routeTable
                .match(path)
                .map(exchange::withRouteMatch)
                .map(StageOutcome::proceed)
                .orElseGet(() -> StageOutcome.halt(new GatewayResult.RouteNotFound(path)));
        return Uni.createFrom().item(outcome);
    }

    @Override
    public String name() {
        return "route-match";
    }
}
