package portico.support;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import portico.core.model.gateway.PreparedProxyRequest;
import portico.core.model.gateway.ProxyResponse;
import portico.core.port.out.ProxyClient;

/**
 * Proxy client double that records requests and answers with a configurable behaviour.
 */
public final class ScriptedProxyClient implements ProxyClient {

    public final List<PreparedProxyRequest> requests = new CopyOnWriteArrayList<>();

    private volatile Function<PreparedProxyRequest, Uni<ProxyResponse>> behaviour =
            request -> Uni.createFrom().item(response(200, "{\"ok\":true}"));

    public static ProxyResponse response(int status, String body) {
        return new ProxyResponse(
                status, Map.of("Content-Type", List.of("application/json")), body.getBytes());
    }

    public void respondWith(int status, String body) {
        behaviour = request -> Uni.createFrom().item(response(status, body));
    }

    public void failWith(RuntimeException error) {
        behaviour = request -> Uni.createFrom().failure(error);
    }

    @Override
    public Uni<ProxyResponse> forward(PreparedProxyRequest request) {
        requests.add(request);
        return behaviour.apply(request);
    }
}
