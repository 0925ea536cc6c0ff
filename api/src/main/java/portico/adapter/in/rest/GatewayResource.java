package portico.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import portico.adapter.in.http.RequestIdFilter;
import portico.adapter.in.problem.GatewayProblem;
import portico.core.model.gateway.GatewayRequest;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.routing.BackendService;
import portico.core.port.in.GatewayUseCase;
import portico.core.port.out.Metrics;

/**
 * Entry point for proxied traffic under {@code /api}.
 *
 * <p>Converts the inbound HTTP request into a {@link GatewayRequest}, runs it through the
 * gateway and maps the {@link GatewayResult} back to HTTP.
 */
@Path("/api")
@ApplicationScoped
public class GatewayResource {

    private final GatewayUseCase gatewayUseCase;
    private final RouteDirectory routeDirectory;
    private final Metrics metrics;

    @Inject
    public GatewayResource(GatewayUseCase gatewayUseCase, RouteDirectory routeDirectory, Metrics metrics) {
        this.gatewayUseCase = gatewayUseCase;
        this.routeDirectory = routeDirectory;
        this.metrics = metrics;
    }

    @GET
    @Path("{path:.*}")
    public Uni<Response> proxyGet(
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest serverRequest) {
        return proxyRequest(requestContext, serverRequest, null);
    }

    @POST
    @Path("{path:.*}")
    public Uni<Response> proxyPost(
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest serverRequest,
            byte[] body) {
        return proxyRequest(requestContext, serverRequest, body);
    }

    @PUT
    @Path("{path:.*}")
    public Uni<Response> proxyPut(
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest serverRequest,
            byte[] body) {
        return proxyRequest(requestContext, serverRequest, body);
    }

    @DELETE
    @Path("{path:.*}")
    public Uni<Response> proxyDelete(
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest serverRequest) {
        return proxyRequest(requestContext, serverRequest, null);
    }

    @PATCH
    @Path("{path:.*}")
    public Uni<Response> proxyPatch(
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest serverRequest,
            byte[] body) {
        return proxyRequest(requestContext, serverRequest, body);
    }

    @HEAD
    @Path("{path:.*}")
    public Uni<Response> proxyHead(
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest serverRequest) {
        return proxyRequest(requestContext, serverRequest, null);
    }

    @OPTIONS
    @Path("{path:.*}")
    public Uni<Response> proxyOptions(
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest serverRequest) {
        return proxyRequest(requestContext, serverRequest, null);
    }

    private Uni<Response> proxyRequest(
            ContainerRequestContext requestContext, HttpServerRequest serverRequest, byte[] body) {
        // Percent-encoding is kept as received so the backend sees the same path segments
        var rawPath = requestContext.getUriInfo().getRequestUri().getRawPath();
        var gatewayRequest = toGatewayRequest(rawPath, requestContext, serverRequest, body);
        return gatewayUseCase.forward(gatewayRequest).map(result -> {
            var response = toResponse(result, gatewayRequest);
            metrics.recordRequest(serviceOf(result), gatewayRequest.method(), response.getStatus());
            return response;
        });
    }

    private GatewayRequest toGatewayRequest(
            String path, ContainerRequestContext requestContext, HttpServerRequest serverRequest, byte[] body) {
        var headers = new LinkedHashMap<String, List<String>>();
        for (var entry : requestContext.getHeaders().entrySet()) {
            headers.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        var remoteAddress = serverRequest != null ? serverRequest.remoteAddress() : null;

        return new GatewayRequest(
                requestContext.getMethod(),
                path,
                headers,
                requestContext.getUriInfo().getRequestUri(),
                body,
                remoteAddress != null ? remoteAddress.host() : null,
                RequestIdFilter.resolve(requestContext.getHeaderString(RequestIdFilter.HEADER)));
    }

    Response toResponse(GatewayResult result, GatewayRequest request) {
        if (result instanceof GatewayResult.Success success) {
            var responseBuilder = Response.status(success.statusCode());
            for (var entry : success.headers().entrySet()) {
                // The request id header is owned by the gateway and already set on the response
                if (entry.getKey().equalsIgnoreCase(RequestIdFilter.HEADER)) {
                    continue;
                }
                for (var value : entry.getValue()) {
                    responseBuilder.header(entry.getKey(), value);
                }
            }
            if (success.body().length > 0) {
                responseBuilder.entity(success.body());
            }
            return responseBuilder.build();
        }
        return GatewayProblem.toResponse(toProblem(result, request.requestId()));
    }

    private HttpProblem toProblem(GatewayResult result, String requestId) {
        if (result instanceof GatewayResult.RouteNotFound notFound) {
            return GatewayProblem.routeNotFound(notFound.path(), routeDirectory.availableRoutes(), requestId);
        }
        if (result instanceof GatewayResult.Unauthorized unauthorized) {
            return GatewayProblem.unauthorized(unauthorized.reason(), unauthorized.detail(), requestId);
        }
        if (result instanceof GatewayResult.RateLimited limited) {
            return GatewayProblem.rateLimited(limited.group(), limited.decision(), requestId);
        }
        if (result instanceof GatewayResult.CircuitOpen open) {
            return GatewayProblem.circuitOpen(open.service(), open.retryAfterSeconds(), requestId);
        }
        if (result instanceof GatewayResult.BackendError error) {
            return GatewayProblem.backendError(error.service(), error.failure(), error.message(), requestId);
        }
        if (result instanceof GatewayResult.StoreUnavailable unavailable) {
            return GatewayProblem.storeUnavailable(unavailable.feature(), requestId);
        }
        throw new IllegalStateException("Unhandled gateway result: " + result.getClass().getSimpleName());
    }

    private static BackendService serviceOf(GatewayResult result) {
        if (result instanceof GatewayResult.Success success) {
            return success.service();
        }
        if (result instanceof GatewayResult.CircuitOpen open) {
            return open.service();
        }
        if (result instanceof GatewayResult.BackendError error) {
            return error.service();
        }
        return null;
    }
}
