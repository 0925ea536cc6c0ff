package portico.core.model.routing;

/**
 * A route selected for a request, with the path the backend will see.
 *
 * @param route         the matched route
 * @param rewrittenPath the request path after applying the route's rewrite rule
 */
public record RouteMatch(Route route, String rewrittenPath) {

    public BackendService service() {
        return route.service();
    }
}
