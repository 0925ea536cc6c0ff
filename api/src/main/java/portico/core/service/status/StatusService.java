package portico.core.service.status;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import portico.core.model.routing.BackendService;
import portico.core.model.status.GatewayStatus;
import portico.core.model.status.InstanceStatus;
import portico.core.model.status.ServiceStatus;
import portico.core.port.in.StatusUseCase;
import portico.core.port.out.BackendHealthProbe;
import portico.core.service.resilience.CircuitBreakerRegistry;
import portico.core.service.routing.BackendRegistry;

/**
 * Polls every registered backend instance and aggregates the results.
 *
 * <p>Operator-facing only; circuit breakers learn health from real traffic and never
 * consult this.
 */
@ApplicationScoped
public class StatusService implements StatusUseCase {

    private final BackendRegistry backendRegistry;
    private final BackendHealthProbe healthProbe;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Clock clock;

    @Inject
    public StatusService(
            BackendRegistry backendRegistry,
            BackendHealthProbe healthProbe,
            CircuitBreakerRegistry circuitBreakers,
            Clock clock) {
        this.backendRegistry = backendRegistry;
        this.healthProbe = healthProbe;
        this.circuitBreakers = circuitBreakers;
        this.clock = clock;
    }

    @Override
    public Uni<GatewayStatus> checkStatus() {
        List<Uni<ServiceStatus>> checks = new ArrayList<>();
        for (var service : BackendService.values()) {
            checks.add(checkService(service));
        }
        return Uni.join()
                .all(checks)
                .andFailFast()
                .map(services -> new GatewayStatus(clock.instant(), services));
    }

    private Uni<ServiceStatus> checkService(BackendService service) {
        var circuit = circuitBreakers.forService(service).state();
        var instances = backendRegistry.instancesOf(service);
        if (instances.isEmpty()) {
            return Uni.createFrom().item(new ServiceStatus(service, circuit, List.of()));
        }
        List<Uni<InstanceStatus>> probes = new ArrayList<>();
        for (var instance : instances) {
            probes.add(healthProbe.probe(instance));
        }
        return Uni.join().all(probes).andFailFast().map(results -> new ServiceStatus(service, circuit, results));
    }
}
