package portico.core.port.out;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.PreparedProxyRequest;
import portico.core.model.gateway.ProxyResponse;

/**
 * Sends a prepared request to a backend instance.
 *
 * <p>Implementations fail with {@code BackendTimeoutException} when the call times out
 * and with {@code BackendUnavailableException} when the backend cannot be reached.
 */
public interface ProxyClient {

    Uni<ProxyResponse> forward(PreparedProxyRequest request);
}
