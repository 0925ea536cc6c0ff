package portico.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import portico.core.model.gateway.GatewayResult;
import portico.core.model.resilience.CircuitState;
import portico.core.model.routing.BackendService;
import portico.core.port.out.Metrics;

/**
 * Metrics double that keeps the events tests care about.
 */
public final class RecordingMetrics implements Metrics {

    public final List<String> transitions = new CopyOnWriteArrayList<>();
    public final List<String> storeFailures = new CopyOnWriteArrayList<>();
    public final List<String> authFailures = new CopyOnWriteArrayList<>();
    public final List<String> rateLimitExceeded = new CopyOnWriteArrayList<>();
    public final List<GatewayResult> results = new CopyOnWriteArrayList<>();

    @Override
    public void recordRequest(BackendService service, String method, int statusCode) {}

    @Override
    public void recordProxyLatency(BackendService service, String method, int statusCode, long latencyMs) {}

    @Override
    public void recordGatewayResult(GatewayResult result) {
        results.add(result);
    }

    @Override
    public void recordRateLimitExceeded(String group) {
        rateLimitExceeded.add(group);
    }

    @Override
    public void recordAuthFailure(String reason) {
        authFailures.add(reason);
    }

    @Override
    public void recordCircuitTransition(BackendService service, CircuitState from, CircuitState to) {
        transitions.add(service.id() + ":" + from + "->" + to);
    }

    @Override
    public void recordCircuitRejection(BackendService service) {}

    @Override
    public void recordStoreFailure(String feature, String operation) {
        storeFailures.add(feature + ":" + operation);
    }
}
