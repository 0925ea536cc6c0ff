package portico.core.model.status;

import java.util.List;

import portico.core.model.resilience.CircuitState;
import portico.core.model.routing.BackendService;

/**
 * Aggregated health of one backend service.
 *
 * <p>A service is healthy when every instance is healthy.
 */
public record ServiceStatus(BackendService service, CircuitState circuit, List<InstanceStatus> instances) {

    public ServiceStatus {
        instances = instances == null ? List.of() : List.copyOf(instances);
    }

    public boolean healthy() {
        return !instances.isEmpty() && instances.stream().allMatch(InstanceStatus::healthy);
    }
}
