package portico.adapter.in.dto;

import java.util.List;

import portico.core.model.routing.Route;

/**
 * Self-description of the gateway, built from the configured route table.
 *
 * @param endpoints endpoints served by the gateway itself, as {@code METHOD path}
 */
public record ApiDocsResponse(String name, String version, List<RouteDoc> routes, List<String> endpoints) {

    /**
     * One proxied route.
     *
     * @param rewrite replacement for the prefix on the backend side
     */
    public record RouteDoc(String prefix, String service, String access, String rewrite, String rateLimitGroup) {

        public static RouteDoc fromModel(Route route) {
            return new RouteDoc(
                    route.prefix(), route.service().id(), route.access().name(), route.rewrite(), route.rateLimitGroup());
        }
    }

    public static ApiDocsResponse of(String name, String version, List<Route> routes, List<String> endpoints) {
        return new ApiDocsResponse(
                name, version, routes.stream().map(RouteDoc::fromModel).toList(), List.copyOf(endpoints));
    }
}
