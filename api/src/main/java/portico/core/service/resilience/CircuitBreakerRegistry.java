package portico.core.service.resilience;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import portico.core.model.resilience.CircuitBreakerSettings;
import portico.core.model.resilience.CircuitBreakerSnapshot;
import portico.core.model.routing.BackendService;
import portico.core.port.in.CircuitBreakerManagement;
import portico.core.port.out.Metrics;

/**
 * Owns one circuit breaker per backend service for the lifetime of the process.
 */
@ApplicationScoped
public class CircuitBreakerRegistry implements CircuitBreakerManagement {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerRegistry.class);

    private final Map<BackendService, CircuitBreaker> breakers;

    @Inject
    public CircuitBreakerRegistry(CircuitBreakerSettings settings, Clock clock, Metrics metrics) {
        var map = new EnumMap<BackendService, CircuitBreaker>(BackendService.class);
        for (var service : BackendService.values()) {
            map.put(service, new CircuitBreaker(service, settings, clock, metrics));
        }
        this.breakers = map;
        LOG.infov(
                "Circuit breakers ready for {0} (threshold={1}, resetTimeout={2})",
                Arrays.toString(BackendService.values()), settings.failureThreshold(), settings.resetTimeout());
    }

    public CircuitBreaker forService(BackendService service) {
        return breakers.get(service);
    }

    @Override
    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream().map(CircuitBreaker::snapshot).toList();
    }

    @Override
    public CircuitBreakerSnapshot reset(BackendService service) {
        var breaker = breakers.get(service);
        breaker.reset();
        return breaker.snapshot();
    }
}
