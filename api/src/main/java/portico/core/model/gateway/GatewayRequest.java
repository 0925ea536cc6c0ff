package portico.core.model.gateway;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * An inbound request as seen by the gateway core.
 *
 * @param method    HTTP method
 * @param path      raw request path with percent-encoding intact, always starting with {@code /}
 * @param headers   request headers
 * @param requestUri the full request URI as received
 * @param body      request body, empty when absent
 * @param clientIp  remote address of the socket connection (may be null)
 * @param requestId identifier propagated to backends and returned to the client
 */
public record GatewayRequest(
        String method,
        String path,
        Map<String, List<String>> headers,
        URI requestUri,
        byte[] body,
        String clientIp,
        String requestId) {

    public GatewayRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    /**
     * Return the first value of a header, matching the name case-insensitively.
     */
    public String getHeaderString(String name) {
        var values = headers.get(name);
        if (values == null) {
            for (var entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    values = entry.getValue();
                    break;
                }
            }
        }
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    public String rawQuery() {
        return requestUri != null ? requestUri.getRawQuery() : null;
    }
}
