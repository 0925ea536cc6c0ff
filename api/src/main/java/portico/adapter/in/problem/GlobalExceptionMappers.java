package portico.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotAllowedException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import portico.adapter.in.http.RequestIdFilter;
import portico.adapter.in.rest.RouteDirectory;
import portico.core.model.common.StoreUnavailableException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Gateway outcomes never reach these mappers; they cover paths and methods no resource
 * serves, administrative input errors and anything unexpected, which is reported without
 * internal details. {@code HttpProblem} and other {@code WebApplicationException}s are
 * rendered by the problem extension.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    private final RouteDirectory routeDirectory;

    @Inject
    public GlobalExceptionMappers(RouteDirectory routeDirectory) {
        this.routeDirectory = routeDirectory;
    }

    // Ahead of the problem extension's own WebApplicationException mappers
    @ServerExceptionMapper(priority = Priorities.USER - 100)
    public Response mapNotFoundException(NotFoundException e, ContainerRequestContext requestContext) {
        return routeNotFound(requestContext);
    }

    /**
     * A path served only for other methods, e.g. {@code POST /api/status}, is reported like any unmatched path.
     */
    @ServerExceptionMapper(priority = Priorities.USER - 100)
    public Response mapNotAllowedException(NotAllowedException e, ContainerRequestContext requestContext) {
        return routeNotFound(requestContext);
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e, ContainerRequestContext requestContext) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return GatewayProblem.toResponse(GatewayProblem.badRequest(e.getMessage(), requestId(requestContext)));
    }

    @ServerExceptionMapper
    public Response mapStoreUnavailableException(
            StoreUnavailableException e, ContainerRequestContext requestContext) {
        LOG.warnv("Store operation {0} failed: {1}", e.getOperation(), e.getMessage());
        return GatewayProblem.toResponse(GatewayProblem.storeUnavailable("store", requestId(requestContext)));
    }

    @ServerExceptionMapper
    public Response mapThrowable(Throwable e, ContainerRequestContext requestContext) {
        var requestId = requestId(requestContext);
        LOG.errorv(e, "Unhandled error for request {0}", requestId);
        return GatewayProblem.toResponse(GatewayProblem.internalError(requestId));
    }

    private Response routeNotFound(ContainerRequestContext requestContext) {
        var path = requestContext.getUriInfo().getRequestUri().getRawPath();
        LOG.debugv("No route for {0} {1}", requestContext.getMethod(), path);
        return GatewayProblem.toResponse(
                GatewayProblem.routeNotFound(path, routeDirectory.availableRoutes(), requestId(requestContext)));
    }

    private static String requestId(ContainerRequestContext requestContext) {
        return RequestIdFilter.resolve(requestContext.getHeaderString(RequestIdFilter.HEADER));
    }
}
