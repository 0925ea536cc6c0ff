package portico.core.port.out;

import portico.core.model.gateway.GatewayResult;
import portico.core.model.resilience.CircuitState;
import portico.core.model.routing.BackendService;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Record a completed gateway request.
     *
     * @param service the target service, null when no route matched
     * @param method the HTTP method
     * @param statusCode the response status code
     */
    void recordRequest(BackendService service, String method, int statusCode);

    /**
     * Record proxy latency for a backend call.
     */
    void recordProxyLatency(BackendService service, String method, int statusCode, long latencyMs);

    /**
     * Record the kind of terminal result.
     */
    void recordGatewayResult(GatewayResult result);

    void recordRateLimitExceeded(String group);

    void recordAuthFailure(String reason);

    /**
     * Record a circuit breaker state change.
     */
    void recordCircuitTransition(BackendService service, CircuitState from, CircuitState to);

    void recordCircuitRejection(BackendService service);

    /**
     * Record a failed or timed-out store operation.
     *
     * @param feature the feature that used the store (rate-limiting, token-revocation)
     * @param operation the store operation
     */
    void recordStoreFailure(String feature, String operation);
}
