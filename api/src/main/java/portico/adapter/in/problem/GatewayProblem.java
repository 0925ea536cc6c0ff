package portico.adapter.in.problem;

import java.util.List;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import portico.core.model.auth.UnauthorizedReason;
import portico.core.model.gateway.BackendFailure;
import portico.core.model.ratelimit.RateLimitDecision;
import portico.core.model.routing.BackendService;
import portico.core.service.ratelimit.RateLimitHeaders;

/**
 * RFC 7807 Problem Details factory for gateway errors.
 *
 * <p>Every problem carries a {@code kind} member naming the error category and the
 * {@code requestId} of the request that produced it.
 */
public final class GatewayProblem {

    public static final String PROBLEM_JSON = "application/problem+json";

    static final String KIND = "kind";
    static final String REQUEST_ID = "requestId";

    private GatewayProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Gateway pipeline errors ==========

    public static HttpProblem routeNotFound(String path, List<String> availableRoutes, String requestId) {
        return HttpProblem.builder()
                .withTitle("Route Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No route matches path '%s'".formatted(path))
                .with(KIND, "ROUTE_NOT_FOUND")
                .with(REQUEST_ID, requestId)
                .with("path", path)
                .with("availableRoutes", availableRoutes)
                .build();
    }

    public static HttpProblem unauthorized(UnauthorizedReason reason, String detail, String requestId) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail != null ? detail : reason.defaultMessage())
                .withHeader("WWW-Authenticate", "Bearer")
                .with(KIND, "UNAUTHORIZED")
                .with(REQUEST_ID, requestId)
                .with("reason", reason.name())
                .build();
    }

    public static HttpProblem rateLimited(String group, RateLimitDecision decision, String requestId) {
        var builder = HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail("Rate limit exceeded, retry after %d seconds".formatted(decision.retryAfterSeconds()))
                .with(KIND, "RATE_LIMITED")
                .with(REQUEST_ID, requestId)
                .with("group", group)
                .with("limit", decision.limit())
                .with("retryAfter", decision.retryAfterSeconds());
        RateLimitHeaders.of(decision).forEach(builder::withHeader);
        return builder.build();
    }

    public static HttpProblem circuitOpen(BackendService service, long retryAfterSeconds, String requestId) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail("Service '%s' is temporarily unavailable".formatted(service.id()))
                .withHeader(RateLimitHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .with(KIND, "CIRCUIT_OPEN")
                .with(REQUEST_ID, requestId)
                .with("service", service.id())
                .build();
    }

    public static HttpProblem backendError(
            BackendService service, BackendFailure failure, String message, String requestId) {
        var builder = HttpProblem.builder()
                .withTitle(titleFor(failure))
                .withStatus(statusFor(failure))
                .withDetail(message)
                .with(KIND, "BACKEND_ERROR")
                .with(REQUEST_ID, requestId);
        if (service != null) {
            builder.with("service", service.id());
        }
        return builder.build();
    }

    public static HttpProblem storeUnavailable(String feature, String requestId) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail("The %s store is unavailable".formatted(feature))
                .with(KIND, "STORE_UNAVAILABLE")
                .with(REQUEST_ID, requestId)
                .with("feature", feature)
                .build();
    }

    // ========== Administrative errors ==========

    public static HttpProblem badRequest(String detail, String requestId) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .with(KIND, "BAD_REQUEST")
                .with(REQUEST_ID, requestId)
                .build();
    }

    public static HttpProblem forbidden(String detail, String requestId) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .with(KIND, "FORBIDDEN")
                .with(REQUEST_ID, requestId)
                .build();
    }

    public static HttpProblem internalError(String requestId) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail("Internal gateway error")
                .with(KIND, "INTERNAL_ERROR")
                .with(REQUEST_ID, requestId)
                .build();
    }

    /**
     * Render a problem as a response, copying the problem's headers.
     */
    public static Response toResponse(HttpProblem problem) {
        var builder = Response.status(problem.getStatusCode()).type(PROBLEM_JSON).entity(problem);
        problem.getHeaders().forEach(builder::header);
        return builder.build();
    }

    private static Status statusFor(BackendFailure failure) {
        if (failure == BackendFailure.TIMEOUT) {
            return Status.GATEWAY_TIMEOUT;
        }
        if (failure == BackendFailure.UNREACHABLE) {
            return Status.BAD_GATEWAY;
        }
        return Status.INTERNAL_SERVER_ERROR;
    }

    private static String titleFor(BackendFailure failure) {
        if (failure == BackendFailure.TIMEOUT) {
            return "Gateway Timeout";
        }
        if (failure == BackendFailure.UNREACHABLE) {
            return "Bad Gateway";
        }
        return "Internal Server Error";
    }
}
