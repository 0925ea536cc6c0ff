package portico.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import portico.core.port.in.CircuitBreakerManagement;

/**
 * Reports the state of every backend circuit breaker.
 *
 * <p>Always UP: an open breaker degrades one backend, the gateway itself can still
 * serve the others. Open breakers should alert via the
 * {@code portico.circuitbreaker.state} gauge.
 */
@Readiness
@ApplicationScoped
public class CircuitBreakerHealthCheck implements HealthCheck {

    private final CircuitBreakerManagement circuitBreakers;

    @Inject
    public CircuitBreakerHealthCheck(CircuitBreakerManagement circuitBreakers) {
        this.circuitBreakers = circuitBreakers;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("circuit-breakers");
        for (var snapshot : circuitBreakers.snapshots()) {
            builder.withData(snapshot.service().id(), snapshot.state().name());
            builder.withData(snapshot.service().id() + ".failures", snapshot.failureCount());
        }
        return builder.up().build();
    }
}
