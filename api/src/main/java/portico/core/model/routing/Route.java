package portico.core.model.routing;

import java.util.Objects;

/**
 * Maps a path prefix to a backend service.
 *
 * @param prefix         path prefix, starting with {@code /} and without a trailing slash
 * @param service        the backend service requests are forwarded to
 * @param rewrite        replacement for the matched prefix ({@code /} strips it)
 * @param access         authentication policy for the route
 * @param rateLimitGroup name of the rate limit group that counts requests on this route
 */
public record Route(String prefix, BackendService service, String rewrite, RouteAccess access, String rateLimitGroup) {

    public Route {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(access, "access must not be null");
        Objects.requireNonNull(rateLimitGroup, "rateLimitGroup must not be null");
        prefix = normalizePrefix(prefix);
        rewrite = rewrite == null ? prefix : normalizePrefix(rewrite);
    }

    /**
     * Check whether a request path falls under this route.
     *
     * <p>The prefix must be followed by the end of the path or a {@code /}, so
     * {@code /api/orders} matches {@code /api/orders/7} but not {@code /api/ordersx}.
     */
    public boolean matches(String path) {
        if (path == null || !path.startsWith(prefix)) {
            return false;
        }
        if (path.length() == prefix.length() || "/".equals(prefix)) {
            return true;
        }
        return path.charAt(prefix.length()) == '/';
    }

    /**
     * Rewrite a matching path for the backend.
     *
     * @param path a path for which {@link #matches(String)} is true
     * @return the path to request from the backend
     */
    public String rewritePath(String path) {
        var remainder = path.substring("/".equals(prefix) ? 0 : prefix.length());
        if ("/".equals(rewrite)) {
            return remainder.isEmpty() ? "/" : remainder;
        }
        return rewrite + remainder;
    }

    private static String normalizePrefix(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Route prefix must not be blank");
        }
        var normalized = value.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
