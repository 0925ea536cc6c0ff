package portico.core.service.common;

import java.util.Locale;

import portico.core.model.gateway.GatewayRequest;

/**
 * Determines the client address used as rate limit identity.
 *
 * <p>When the socket peer is a trusted proxy, checks in order:
 * <ol>
 *   <li>the {@code for} parameter of the first RFC 7239 {@code Forwarded} element</li>
 *   <li>the first address in {@code X-Forwarded-For}</li>
 *   <li>the socket's remote address</li>
 * </ol>
 *
 * <p>Any other peer is identified by its socket address and its forwarding headers are ignored.
 */
public final class ClientIpExtractor {

    static final String UNKNOWN = "unknown";

    private final TrustedProxyValidator trustedProxies;

    public ClientIpExtractor(TrustedProxyValidator trustedProxies) {
        this.trustedProxies = trustedProxies;
    }

    /**
     * @return the client address, or {@code unknown} when none is available
     */
    public String extract(GatewayRequest request) {
        var socketIp = request.clientIp();
        if (!trustedProxies.isTrusted(socketIp)) {
            return socketIp == null || socketIp.isBlank() ? UNKNOWN : socketIp;
        }

        var forwarded = request.getHeaderString("Forwarded");
        if (forwarded != null) {
            var forValue = forwardedFor(forwarded);
            if (forValue != null) {
                return forValue;
            }
        }

        var xForwardedFor = request.getHeaderString("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            var first = xForwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        return socketIp;
    }

    /**
     * Read the {@code for} node of the first element of a Forwarded header.
     *
     * <p>Quotes, IPv6 brackets and ports are stripped; obfuscated and {@code unknown}
     * identifiers are ignored.
     */
    static String forwardedFor(String forwarded) {
        var firstElement = forwarded.split(",")[0];
        for (var pair : firstElement.split(";")) {
            var keyValue = pair.trim().split("=", 2);
            if (keyValue.length != 2 || !keyValue[0].trim().equalsIgnoreCase("for")) {
                continue;
            }
            var node = keyValue[1].trim();
            if (node.length() >= 2 && node.startsWith("\"") && node.endsWith("\"")) {
                node = node.substring(1, node.length() - 1);
            }
            node = stripPort(node);
            if (node.isEmpty() || node.startsWith("_") || UNKNOWN.equals(node.toLowerCase(Locale.ROOT))) {
                return null;
            }
            return node;
        }
        return null;
    }

    private static String stripPort(String node) {
        if (node.startsWith("[")) {
            var end = node.indexOf(']');
            return end > 0 ? node.substring(1, end) : node;
        }
        var colon = node.indexOf(':');
        // More than one colon is a bare IPv6 address, which carries no port
        if (colon > 0 && colon == node.lastIndexOf(':')) {
            return node.substring(0, colon);
        }
        return node;
    }
}
