package portico.core.service.gateway;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.gateway.BackendFailure;
import portico.core.model.gateway.BackendTimeoutException;
import portico.core.model.gateway.BackendUnavailableException;
import portico.core.model.gateway.GatewayExchange;
import portico.core.model.gateway.GatewayResult;
import portico.core.model.gateway.ProxyResponse;
import portico.core.model.gateway.StageOutcome;
import portico.core.model.ratelimit.RateLimitDecision;
import portico.core.model.resilience.CircuitOpenException;
import portico.core.port.out.Metrics;
import portico.core.port.out.ProxyClient;
import portico.core.service.ratelimit.RateLimitHeaders;
import portico.core.service.resilience.CircuitBreakerRegistry;
import portico.core.service.routing.BackendRegistry;

/**
 * Selects a backend instance and forwards the request through the service's
 * circuit breaker. Always terminal.
 *
 * <p>Backend 5xx responses count as breaker failures but are relayed to the client
 * unchanged.
 */
@ApplicationScoped
public class ProxyForwardStage implements GatewayStage {

    private static final Logger LOG = Logger.getLogger(ProxyForwardStage.class);

    private final BackendRegistry backendRegistry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ProxyRequestPreparer requestPreparer;
    private final ProxyClient proxyClient;
    private final Metrics metrics;

    @Inject
    public ProxyForwardStage(
            BackendRegistry backendRegistry,
            CircuitBreakerRegistry circuitBreakers,
            ProxyRequestPreparer requestPreparer,
            ProxyClient proxyClient,
            Metrics metrics) {
        this.backendRegistry = backendRegistry;
        this.circuitBreakers = circuitBreakers;
        this.requestPreparer = requestPreparer;
        this.proxyClient = proxyClient;
        this.metrics = metrics;
    }

    @Override
    public Uni<StageOutcome> apply(GatewayExchange exchange) {
        var request = exchange.request();
        var match = exchange.requireRouteMatch();
        var service = match.service();

        var instance = backendRegistry.select(service);
        if (instance.isEmpty()) {
            return Uni.createFrom()
                    .item(StageOutcome.halt(new GatewayResult.BackendError(
                            service, BackendFailure.UNREACHABLE, "No instances registered for " + service.id())));
        }

        var prepared = requestPreparer.prepare(request, match, instance.get(), exchange.authContext());
        var breaker = circuitBreakers.forService(service);
        final long startTime = System.nanoTime();

        return breaker.execute(() -> proxyClient.forward(prepared), ProxyResponse::isServerError)
                .map(response -> {
                    long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
                    metrics.recordProxyLatency(service, request.method(), response.statusCode(), latencyMs);
                    var relayed = withRateLimitHeaders(response, exchange.rateLimitDecision().orElse(null));
                    return StageOutcome.halt(GatewayResult.Success.from(service, relayed));
                })
                .onFailure(CircuitOpenException.class)
                .recoverWithItem(error -> {
                    var open = (CircuitOpenException) error;
                    LOG.debugf("Short-circuited %s %s: circuit open for %s", request.method(), request.path(), service.id());
                    return StageOutcome.halt(new GatewayResult.CircuitOpen(service, open.getRetryAfterSeconds()));
                })
                .onFailure(BackendTimeoutException.class)
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Backend {0} timed out for {1} {2} [{3}]",
                            service.id(), request.method(), request.path(), request.requestId());
                    return StageOutcome.halt(new GatewayResult.BackendError(
                            service, BackendFailure.TIMEOUT, "Backend did not respond in time"));
                })
                .onFailure(BackendUnavailableException.class)
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Backend {0} unreachable for {1} {2} [{3}]: {4}",
                            service.id(), request.method(), request.path(), request.requestId(), error.getMessage());
                    return StageOutcome.halt(new GatewayResult.BackendError(
                            service, BackendFailure.UNREACHABLE, "Backend service unavailable"));
                });
    }

    private ProxyResponse withRateLimitHeaders(ProxyResponse response, RateLimitDecision decision) {
        if (decision == null) {
            return response;
        }
        var headers = new LinkedHashMap<String, List<String>>(response.headers());
        RateLimitHeaders.of(decision).forEach((name, value) -> headers.put(name, new ArrayList<>(List.of(value))));
        return new ProxyResponse(response.statusCode(), headers, response.body());
    }

    @Override
    public String name() {
        return "proxy-forward";
    }
}
