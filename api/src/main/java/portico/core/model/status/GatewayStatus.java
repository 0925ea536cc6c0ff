package portico.core.model.status;

import java.time.Instant;
import java.util.List;

/**
 * Operator view of the gateway and its backends.
 */
public record GatewayStatus(Instant checkedAt, List<ServiceStatus> services) {

    public GatewayStatus {
        services = services == null ? List.of() : List.copyOf(services);
    }

    /**
     * True when every backend service is healthy; otherwise the gateway is degraded.
     */
    public boolean healthy() {
        return services.stream().allMatch(ServiceStatus::healthy);
    }
}
