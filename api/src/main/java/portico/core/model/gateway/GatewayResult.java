package portico.core.model.gateway;

import java.util.List;
import java.util.Map;

import portico.core.model.auth.UnauthorizedReason;
import portico.core.model.ratelimit.RateLimitDecision;
import portico.core.model.routing.BackendService;

/**
 * Terminal outcome of a gateway request.
 */
public sealed interface GatewayResult {

    /**
     * The backend answered; its response is relayed unchanged (5xx included).
     */
    record Success(BackendService service, int statusCode, Map<String, List<String>> headers, byte[] body)
            implements GatewayResult {
        public Success {
            if (headers == null) {
                headers = Map.of();
            }
            if (body == null) {
                body = new byte[0];
            }
        }

        public static Success from(BackendService service, ProxyResponse response) {
            return new Success(service, response.statusCode(), response.headers(), response.body());
        }
    }

    record RouteNotFound(String path) implements GatewayResult {}

    record Unauthorized(UnauthorizedReason reason, String detail) implements GatewayResult {}

    record RateLimited(String group, RateLimitDecision decision) implements GatewayResult {}

    record CircuitOpen(BackendService service, long retryAfterSeconds) implements GatewayResult {}

    /**
     * The backend could not be used, or the gateway failed unexpectedly.
     *
     * @param service the backend involved, null for failures before a backend was chosen
     */
    record BackendError(BackendService service, BackendFailure failure, String message) implements GatewayResult {}

    /**
     * The shared store needed by a fail-closed feature could not be reached.
     *
     * @param feature the feature that refused the request (e.g. {@code rate-limiting})
     */
    record StoreUnavailable(String feature) implements GatewayResult {}
}
