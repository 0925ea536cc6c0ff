package portico.core.port.in;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.GatewayRequest;
import portico.core.model.gateway.GatewayResult;

/**
 * Use case for forwarding requests through the gateway.
 *
 * <p>Requests are matched against the route table, rate limited, authenticated
 * where the route requires it, and forwarded to a backend instance behind the
 * service's circuit breaker.
 */
public interface GatewayUseCase {

    /**
     * Forward a request through the gateway.
     *
     * @param request the gateway request containing path, method, headers, and body
     * @return the terminal result; never a failed Uni
     */
    Uni<GatewayResult> forward(GatewayRequest request);
}
