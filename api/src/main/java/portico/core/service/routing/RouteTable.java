package portico.core.service.routing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import portico.core.model.routing.Route;
import portico.core.model.routing.RouteMatch;

/**
 * Immutable table of configured routes.
 *
 * <p>Matching picks the longest prefix that matches the path; routes with equal
 * prefix length keep their declaration order.
 */
public final class RouteTable {

    private final List<Route> routes;
    private final List<Route> byPrecedence;

    public RouteTable(List<Route> routes) {
        this.routes = List.copyOf(routes);
        var seen = new HashSet<String>();
        for (var route : this.routes) {
            if (!seen.add(route.prefix())) {
                throw new IllegalArgumentException("Duplicate route prefix: " + route.prefix());
            }
        }
        // List.sort is stable, so equal lengths keep declaration order
        var sorted = new ArrayList<>(this.routes);
        sorted.sort(Comparator.comparingInt((Route r) -> r.prefix().length()).reversed());
        this.byPrecedence = List.copyOf(sorted);
    }

    /**
     * Find the route for a request path.
     *
     * @param path the request path, starting with {@code /}
     * @return the match with its rewritten path, or empty when no route applies
     */
    public Optional<RouteMatch> match(String path) {
        var normalized = path == null || path.isEmpty() ? "/" : path;
        for (var route : byPrecedence) {
            if (route.matches(normalized)) {
                return Optional.of(new RouteMatch(route, route.rewritePath(normalized)));
            }
        }
        return Optional.empty();
    }

    /**
     * Routes in declaration order.
     */
    public List<Route> routes() {
        return routes;
    }

    public List<String> prefixes() {
        return routes.stream().map(Route::prefix).toList();
    }
}
