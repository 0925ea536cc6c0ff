package portico.adapter.in.rest;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import portico.core.model.routing.Route;
import portico.core.service.routing.RouteTable;

/**
 * Paths a client can reach: the proxied route prefixes followed by the endpoints the
 * gateway answers itself.
 */
@ApplicationScoped
public class RouteDirectory {

    static final List<String> LOCAL_ROUTES = List.of("/health", "/api/status", "/api/docs");

    private final RouteTable routeTable;

    @Inject
    public RouteDirectory(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    /**
     * @return route prefixes in declaration order, then the gateway's own endpoints
     */
    public List<String> availableRoutes() {
        var routes = new ArrayList<>(routeTable.prefixes());
        routes.addAll(LOCAL_ROUTES);
        return List.copyOf(routes);
    }

    public List<Route> routes() {
        return routeTable.routes();
    }
}
