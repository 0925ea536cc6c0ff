package portico.core.port.in;

import io.smallrye.mutiny.Uni;

import portico.core.model.status.GatewayStatus;

/**
 * Use case for reporting backend health to operators.
 */
public interface StatusUseCase {

    Uni<GatewayStatus> checkStatus();
}
