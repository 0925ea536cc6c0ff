package portico.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.adapter.in.dto.CircuitBreakerDto;
import portico.core.model.routing.BackendService;
import portico.core.port.in.CircuitBreakerManagement;

/**
 * Administrative view and reset of the per-service circuit breakers.
 */
@Path("/admin/circuit-breakers")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CircuitBreakerResource {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerResource.class);

    private final CircuitBreakerManagement circuitBreakers;
    private final AdminAccess adminAccess;

    @Inject
    public CircuitBreakerResource(CircuitBreakerManagement circuitBreakers, AdminAccess adminAccess) {
        this.circuitBreakers = circuitBreakers;
        this.adminAccess = adminAccess;
    }

    @GET
    public Uni<Response> list(@Context ContainerRequestContext requestContext) {
        return adminAccess.requireAdmin(requestContext).map(admin -> Response.ok(circuitBreakers.snapshots().stream()
                        .map(CircuitBreakerDto::fromModel)
                        .toList())
                .build());
    }

    /**
     * Force a breaker back to CLOSED.
     *
     * @param serviceId the backend service id, e.g. {@code order}
     */
    @POST
    @Path("/{service}/reset")
    public Uni<Response> reset(@PathParam("service") String serviceId, @Context ContainerRequestContext requestContext) {
        return adminAccess.requireAdmin(requestContext).map(admin -> {
            var service = BackendService.fromId(serviceId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown service: " + serviceId));
            LOG.infov("Circuit breaker for {0} reset by {1}", service.id(), admin.userId());
            return Response.ok(CircuitBreakerDto.fromModel(circuitBreakers.reset(service)))
                    .build();
        });
    }
}
