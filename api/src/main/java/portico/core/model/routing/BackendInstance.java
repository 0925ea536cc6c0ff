package portico.core.model.routing;

import java.net.URI;
import java.util.Objects;

/**
 * A reachable address for a logical backend service.
 *
 * @param service the logical service this instance belongs to
 * @param baseUri scheme, host and port (and optional base path) of the instance
 */
public record BackendInstance(BackendService service, URI baseUri) {

    public BackendInstance {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(baseUri, "baseUri must not be null");
        if (baseUri.getHost() == null) {
            throw new IllegalArgumentException("Backend URL has no host: " + baseUri);
        }
        var scheme = baseUri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Backend URL must use http or https: " + baseUri);
        }
    }

    public static BackendInstance of(BackendService service, String url) {
        return new BackendInstance(service, URI.create(url.trim()));
    }

    /**
     * Resolve a gateway-relative path (and optional raw query) against this instance.
     *
     * @param path     the rewritten path, always starting with {@code /}
     * @param rawQuery the raw query string without {@code ?}, or null
     * @return the absolute target URI
     */
    public URI resolve(String path, String rawQuery) {
        var basePath = baseUri.getRawPath() == null ? "" : baseUri.getRawPath();
        if (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        var target = new StringBuilder()
                .append(baseUri.getScheme())
                .append("://")
                .append(baseUri.getRawAuthority())
                .append(basePath)
                .append(path);
        if (rawQuery != null && !rawQuery.isEmpty()) {
            target.append('?').append(rawQuery);
        }
        return URI.create(target.toString());
    }
}
