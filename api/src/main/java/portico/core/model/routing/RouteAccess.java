package portico.core.model.routing;

import java.util.Locale;
import java.util.Set;

/**
 * Authentication policy attached to a route.
 */
public enum RouteAccess {

    /** Never authenticated (e.g. login and registration). */
    PUBLIC,

    /** Every method requires a valid bearer token. */
    AUTHENTICATED,

    /** Safe methods are public, mutations require a valid bearer token. */
    PUBLIC_READ;

    private static final Set<String> READ_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    public boolean requiresAuthentication(String method) {
        return switch (this) {
            case PUBLIC -> false;
            case AUTHENTICATED -> true;
            case PUBLIC_READ -> method == null || !READ_METHODS.contains(method.toUpperCase(Locale.ROOT));
        };
    }
}
