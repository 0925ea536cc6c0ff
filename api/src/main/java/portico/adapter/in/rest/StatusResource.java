package portico.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import portico.adapter.in.dto.GatewayStatusResponse;
import portico.core.port.in.StatusUseCase;

/**
 * Operator status page: probes every backend's {@code /health} endpoint.
 *
 * <p>Returns 200 when every service is healthy and 503 when the gateway is degraded.
 */
@Path("/api/status")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    private final StatusUseCase statusUseCase;

    @Inject
    public StatusResource(StatusUseCase statusUseCase) {
        this.statusUseCase = statusUseCase;
    }

    @GET
    public Uni<Response> status() {
        return statusUseCase.checkStatus().map(status -> Response.status(
                        status.healthy() ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
                .entity(GatewayStatusResponse.fromModel(status))
                .build());
    }
}
