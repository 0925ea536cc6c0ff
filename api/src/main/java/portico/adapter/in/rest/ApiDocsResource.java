package portico.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import portico.adapter.in.dto.ApiDocsResponse;

/**
 * Lists the proxied routes and the gateway's own endpoints.
 */
@Path("/api/docs")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ApiDocsResource {

    static final List<String> GATEWAY_ENDPOINTS = List.of(
            "GET /health",
            "GET /api/status",
            "GET /api/docs",
            "GET /admin/circuit-breakers",
            "POST /admin/circuit-breakers/{service}/reset",
            "POST /admin/tokens/{jti}/revoke");

    private final RouteDirectory routeDirectory;
    private final String name;
    private final String version;

    @Inject
    public ApiDocsResource(
            RouteDirectory routeDirectory,
            @ConfigProperty(name = "quarkus.application.name", defaultValue = "portico") String name,
            @ConfigProperty(name = "quarkus.application.version", defaultValue = "unknown") String version) {
        this.routeDirectory = routeDirectory;
        this.name = name;
        this.version = version;
    }

    @GET
    public ApiDocsResponse docs() {
        return ApiDocsResponse.of(name, version, routeDirectory.routes(), GATEWAY_ENDPOINTS);
    }
}
