package portico.core.model.routing;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Logical backend services reachable through the gateway.
 *
 * <p>Service names in configuration are resolved against this enum when the
 * route table loads, so an unknown name fails startup instead of a request.
 */
public enum BackendService {
    AUTH("auth"),
    PRODUCT("product"),
    ORDER("order");

    private final String id;

    BackendService(String id) {
        this.id = id;
    }

    /**
     * The configuration name of this service (e.g. {@code auth}).
     */
    public String id() {
        return id;
    }

    public static Optional<BackendService> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        var normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.id.equals(normalized)).findFirst();
    }
}
