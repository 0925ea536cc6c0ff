package portico.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.WithDefault;

import portico.core.model.ratelimit.StoreFailureMode;

/**
 * Rate limiting settings, nested under {@code portico.rate-limiting}.
 *
 * <p>Each route names a group; each group has its own window and maximum.
 */
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Limits keyed by group name.
     */
    Map<String, GroupConfig> groups();

    /**
     * Group counted for every route in addition to the route's own group.
     */
    Optional<String> globalGroup();

    interface GroupConfig {

        /**
         * Window length, counted from the first request of a window.
         */
        Duration window();

        long maxRequests();

        /**
         * What to do when the counter store is unavailable.
         *
         * @return FAIL_OPEN to allow uncounted, FAIL_CLOSED to reject (default: FAIL_OPEN)
         */
        @WithDefault("FAIL_OPEN")
        StoreFailureMode onStoreFailure();
    }
}
