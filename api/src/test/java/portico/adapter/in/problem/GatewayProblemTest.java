package portico.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import portico.core.model.auth.UnauthorizedReason;
import portico.core.model.gateway.BackendFailure;
import portico.core.model.ratelimit.RateLimitDecision;
import portico.core.model.routing.BackendService;

@DisplayName("GatewayProblem")
class GatewayProblemTest {

    private static final String REQUEST_ID = "req-42";

    @Nested
    @DisplayName("Pipeline errors")
    class PipelineErrors {

        @Test
        @DisplayName("routeNotFound should list available routes")
        void routeNotFoundShouldListRoutes() {
            var problem = GatewayProblem.routeNotFound("/api/unknown", List.of("/api/auth", "/api/orders"), REQUEST_ID);

            assertEquals(404, problem.getStatusCode());
            assertEquals("ROUTE_NOT_FOUND", problem.getParameters().get(GatewayProblem.KIND));
            assertEquals(REQUEST_ID, problem.getParameters().get(GatewayProblem.REQUEST_ID));
            assertEquals(List.of("/api/auth", "/api/orders"), problem.getParameters().get("availableRoutes"));
        }

        @Test
        @DisplayName("unauthorized should challenge with Bearer and name the reason")
        void unauthorizedShouldChallenge() {
            var problem = GatewayProblem.unauthorized(UnauthorizedReason.EXPIRED_TOKEN, null, REQUEST_ID);

            assertEquals(401, problem.getStatusCode());
            assertEquals("Bearer", problem.getHeaders().get("WWW-Authenticate"));
            assertEquals("EXPIRED_TOKEN", problem.getParameters().get("reason"));
            assertEquals(UnauthorizedReason.EXPIRED_TOKEN.defaultMessage(), problem.getDetail());
        }

        @Test
        @DisplayName("rateLimited should carry the rate limit headers")
        void rateLimitedShouldCarryHeaders() {
            var decision = new RateLimitDecision(false, 0, 5, 900, Instant.ofEpochSecond(1_700_000_600L), 120, 6);

            var problem = GatewayProblem.rateLimited("auth", decision, REQUEST_ID);

            assertEquals(429, problem.getStatusCode());
            assertEquals("5", problem.getHeaders().get("X-RateLimit-Limit"));
            assertEquals("0", problem.getHeaders().get("X-RateLimit-Remaining"));
            assertEquals("1700000600", problem.getHeaders().get("X-RateLimit-Reset"));
            assertEquals("120", problem.getHeaders().get("Retry-After"));
            assertEquals("auth", problem.getParameters().get("group"));
        }

        @Test
        @DisplayName("circuitOpen should return 503 with Retry-After")
        void circuitOpenShouldReturn503() {
            var problem = GatewayProblem.circuitOpen(BackendService.ORDER, 17, REQUEST_ID);

            assertEquals(503, problem.getStatusCode());
            assertEquals("17", problem.getHeaders().get("Retry-After"));
            assertEquals("order", problem.getParameters().get("service"));
            assertEquals("CIRCUIT_OPEN", problem.getParameters().get(GatewayProblem.KIND));
        }

        @Test
        @DisplayName("backendError should map failures to gateway statuses")
        void backendErrorShouldMapStatuses() {
            assertEquals(504, GatewayProblem.backendError(
                            BackendService.ORDER, BackendFailure.TIMEOUT, "timed out", REQUEST_ID)
                    .getStatusCode());
            assertEquals(502, GatewayProblem.backendError(
                            BackendService.ORDER, BackendFailure.UNREACHABLE, "refused", REQUEST_ID)
                    .getStatusCode());
            assertEquals(500, GatewayProblem.backendError(null, BackendFailure.INTERNAL, "boom", REQUEST_ID)
                    .getStatusCode());
        }
    }

    @Test
    @DisplayName("toResponse should use problem+json and copy headers")
    void toResponseShouldCopyHeaders() {
        var response = GatewayProblem.toResponse(GatewayProblem.circuitOpen(BackendService.AUTH, 30, REQUEST_ID));

        assertEquals(503, response.getStatus());
        assertEquals(GatewayProblem.PROBLEM_JSON, response.getMediaType().toString());
        assertEquals("30", response.getHeaderString("Retry-After"));
    }

    @Test
    @DisplayName("internalError should not leak details")
    void internalErrorShouldNotLeakDetails() {
        var problem = GatewayProblem.internalError(REQUEST_ID);

        assertEquals(500, problem.getStatusCode());
        assertFalse(problem.getDetail().contains("Exception"));
    }
}
