package portico.core.service.gateway;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import portico.core.model.auth.AuthContext;
import portico.core.model.gateway.GatewayRequest;
import portico.core.model.gateway.PreparedProxyRequest;
import portico.core.model.routing.BackendInstance;
import portico.core.model.routing.RouteMatch;

/**
 * Prepares proxy requests by applying header filtering and forwarding rules.
 * This encapsulates the rules for:
 * - Filtering hop-by-hop headers (RFC 7230 Section 6.1)
 * - Setting the Host header for the target
 * - Adding X-Forwarded-* and Via headers
 * - Propagating the request id and the authenticated caller's identity
 */
@ApplicationScoped
public class ProxyRequestPreparer {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String USER_ID_HEADER = "X-User-ID";
    public static final String USER_EMAIL_HEADER = "X-User-Email";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    /**
     * HTTP hop-by-hop headers that must not be forwarded to the upstream server.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    /**
     * Headers the gateway sets itself; copies supplied by the client are dropped.
     */
    private static final Set<String> GATEWAY_OWNED_HEADERS = Set.of(
            "host",
            "content-length",
            "x-request-id",
            "x-user-id",
            "x-user-email",
            "x-user-role",
            "x-forwarded-for",
            "x-forwarded-host",
            "x-forwarded-proto",
            "via");

    /**
     * Build the request sent to a backend instance.
     *
     * @param request  the inbound request
     * @param match    the matched route and rewritten path
     * @param instance the selected backend instance
     * @param auth     the caller identity, present on authenticated requests
     * @return the prepared request
     */
    public PreparedProxyRequest prepare(
            GatewayRequest request, RouteMatch match, BackendInstance instance, Optional<AuthContext> auth) {
        var targetUri = instance.resolve(match.rewrittenPath(), request.rawQuery());
        var headers = new LinkedHashMap<String, List<String>>();

        copyFilteredHeaders(request, headers);
        setHostHeader(headers, targetUri);
        addForwardingHeaders(request, headers);
        addViaHeader(request, headers);
        headers.put(REQUEST_ID_HEADER, List.of(request.requestId()));
        auth.ifPresent(context -> addIdentityHeaders(context, headers));

        return new PreparedProxyRequest(request.method(), targetUri, headers, request.body());
    }

    private void copyFilteredHeaders(GatewayRequest request, Map<String, List<String>> headers) {
        var connectionTokens = connectionTokens(request);
        for (var entry : request.headers().entrySet()) {
            var lowerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lowerName)
                    || GATEWAY_OWNED_HEADERS.contains(lowerName)
                    || connectionTokens.contains(lowerName)) {
                continue;
            }
            headers.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
    }

    // Headers named in Connection are hop-by-hop too
    private Set<String> connectionTokens(GatewayRequest request) {
        var connection = request.getHeaderString("Connection");
        if (connection == null || connection.isBlank()) {
            return Set.of();
        }
        var tokens = new HashSet<String>();
        for (var token : connection.split(",")) {
            tokens.add(token.trim().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }

    private void setHostHeader(Map<String, List<String>> headers, URI targetUri) {
        var port = targetUri.getPort();
        var host = targetUri.getHost();
        if (port != -1 && port != 80 && port != 443) {
            host += ":" + port;
        }
        headers.put("Host", List.of(host));
    }

    private void addForwardingHeaders(GatewayRequest request, Map<String, List<String>> headers) {
        var clientIp = request.clientIp();
        var existingXff = request.getHeaderString("X-Forwarded-For");
        if (clientIp != null && !clientIp.isBlank()) {
            var xff = existingXff != null && !existingXff.isBlank() ? existingXff + ", " + clientIp : clientIp;
            headers.put("X-Forwarded-For", List.of(xff));
        } else if (existingXff != null && !existingXff.isBlank()) {
            headers.put("X-Forwarded-For", List.of(existingXff));
        }

        var host = request.getHeaderString("X-Forwarded-Host");
        if (host == null || host.isBlank()) {
            host = request.getHeaderString("Host");
        }
        if (host != null && !host.isBlank()) {
            headers.put("X-Forwarded-Host", List.of(host));
        }

        var proto = request.getHeaderString("X-Forwarded-Proto");
        if (proto == null || proto.isBlank()) {
            proto = request.requestUri() != null && request.requestUri().getScheme() != null
                    ? request.requestUri().getScheme()
                    : "http";
        }
        headers.put("X-Forwarded-Proto", List.of(proto));
    }

    /**
     * Adds the Via header per RFC 7230 to indicate the request passed through this proxy.
     */
    private void addViaHeader(GatewayRequest request, Map<String, List<String>> headers) {
        var viaValue = "1.1 portico";
        var existingVia = request.getHeaderString("Via");
        if (existingVia != null && !existingVia.isBlank()) {
            viaValue = existingVia + ", " + viaValue;
        }
        headers.put("Via", List.of(viaValue));
    }

    private void addIdentityHeaders(AuthContext context, Map<String, List<String>> headers) {
        headers.put(USER_ID_HEADER, List.of(context.userId()));
        if (context.email() != null) {
            headers.put(USER_EMAIL_HEADER, List.of(context.email()));
        }
        headers.put(USER_ROLE_HEADER, List.of(context.role()));
    }

    /**
     * Filters hop-by-hop headers from a backend response before it is relayed.
     */
    public Map<String, List<String>> filterResponseHeaders(Map<String, List<String>> responseHeaders) {
        Map<String, List<String>> filtered = new LinkedHashMap<>();
        for (var entry : responseHeaders.entrySet()) {
            var lowerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP_HEADERS.contains(lowerName) && !"content-length".equals(lowerName)) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }
}
