package portico.adapter.out.telemetry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import portico.core.model.gateway.GatewayResult;
import portico.core.model.resilience.CircuitState;
import portico.core.model.routing.BackendService;
import portico.core.port.out.Metrics;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code portico.requests.total} - Request count by service, method, status</li>
 *   <li>{@code portico.proxy.latency} - Backend response latency</li>
 *   <li>{@code portico.gateway.results} - Terminal result kinds</li>
 *   <li>{@code portico.ratelimit.exceeded.total} - Rate limit rejections by group</li>
 *   <li>{@code portico.auth.failures.total} - Token rejections by reason</li>
 *   <li>{@code portico.circuitbreaker.transitions.total} - Breaker state changes</li>
 *   <li>{@code portico.circuitbreaker.rejected.total} - Calls short-circuited by an open breaker</li>
 *   <li>{@code portico.circuitbreaker.state} - Current breaker state (0 closed, 1 half-open, 2 open)</li>
 *   <li>{@code portico.store.failures.total} - Store errors and timeouts by feature</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private static final String NONE = "none";

    private final MeterRegistry registry;
    private final Map<BackendService, AtomicInteger> circuitStates = new EnumMap<>(BackendService.class);

    @Inject
    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (var service : BackendService.values()) {
            circuitStates.put(service, new AtomicInteger(stateValue(CircuitState.CLOSED)));
        }
    }

    @PostConstruct
    void init() {
        circuitStates.forEach((service, value) -> Gauge.builder(
                        "portico.circuitbreaker.state", value, AtomicInteger::get)
                .description("Circuit breaker state: 0 closed, 1 half-open, 2 open")
                .tag("service", service.id())
                .register(registry));
    }

    @Override
    public void recordRequest(BackendService service, String method, int statusCode) {
        Counter.builder("portico.requests.total")
                .description("Total number of requests processed")
                .tag("service", serviceTag(service))
                .tag("method", method)
                .tag("status", String.valueOf(statusCode))
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .increment();
    }

    @Override
    public void recordProxyLatency(BackendService service, String method, int statusCode, long latencyMs) {
        Timer.builder("portico.proxy.latency")
                .description("Time to receive a response from the backend")
                .tag("service", serviceTag(service))
                .tag("method", method)
                .tag("status_class", statusClass(statusCode))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordGatewayResult(GatewayResult result) {
        Counter.builder("portico.gateway.results")
                .description("Gateway results by kind")
                .tag("result", resultKind(result))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitExceeded(String group) {
        Counter.builder("portico.ratelimit.exceeded.total")
                .description("Requests rejected by a rate limit")
                .tag("group", group)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthFailure(String reason) {
        Counter.builder("portico.auth.failures.total")
                .description("Bearer token rejections")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    @Override
    public void recordCircuitTransition(BackendService service, CircuitState from, CircuitState to) {
        circuitStates.get(service).set(stateValue(to));
        Counter.builder("portico.circuitbreaker.transitions.total")
                .description("Circuit breaker state transitions")
                .tag("service", service.id())
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCircuitRejection(BackendService service) {
        Counter.builder("portico.circuitbreaker.rejected.total")
                .description("Calls short-circuited by an open circuit breaker")
                .tag("service", service.id())
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String feature, String operation) {
        Counter.builder("portico.store.failures.total")
                .description("Shared store failures and timeouts")
                .tag("feature", feature)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    private static String resultKind(GatewayResult result) {
        if (result instanceof GatewayResult.Success) {
            return "success";
        } else if (result instanceof GatewayResult.RouteNotFound) {
            return "route_not_found";
        } else if (result instanceof GatewayResult.Unauthorized) {
            return "unauthorized";
        } else if (result instanceof GatewayResult.RateLimited) {
            return "rate_limited";
        } else if (result instanceof GatewayResult.CircuitOpen) {
            return "circuit_open";
        } else if (result instanceof GatewayResult.BackendError) {
            return "backend_error";
        } else {
            return "store_unavailable";
        }
    }

    private static int stateValue(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    private static String serviceTag(BackendService service) {
        return service != null ? service.id() : NONE;
    }

    private static String statusClass(int statusCode) {
        return (statusCode / 100) + "xx";
    }
}
