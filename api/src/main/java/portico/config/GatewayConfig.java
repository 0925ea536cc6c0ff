package portico.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import portico.core.model.routing.RouteAccess;

/**
 * Configuration mapping for the gateway.
 *
 * <p>Configuration prefix: {@code portico}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code AUTH_SERVICE_URL}, {@code PRODUCT_SERVICE_URL}, {@code ORDER_SERVICE_URL} - backend
 *       base URLs, comma-separated for several instances</li>
 *   <li>{@code JWT_SECRET} - HMAC verification secret (required)</li>
 *   <li>{@code REDIS_URL} - shared store address</li>
 *   <li>{@code TRUSTED_PROXIES} - load balancer addresses allowed to set forwarding headers</li>
 *   <li>{@code ALLOWED_ORIGINS} - CORS origins</li>
 * </ul>
 */
@ConfigMapping(prefix = "portico")
public interface GatewayConfig {

    /**
     * Backend instances keyed by service name ({@code auth}, {@code product}, {@code order}).
     */
    Map<String, BackendConfig> backends();

    /**
     * Route table in declaration order.
     */
    List<RouteConfig> routes();

    /**
     * IPs or CIDR ranges of proxies whose {@code Forwarded} and {@code X-Forwarded-For}
     * headers identify the client. When absent, clients are identified by socket address only.
     */
    Optional<List<String>> trustedProxies();

    JwtConfig jwt();

    RateLimitingConfig rateLimiting();

    CircuitBreakerConfig circuitBreaker();

    ProxyConfig proxy();

    StoreConfig store();

    StatusConfig status();

    interface BackendConfig {

        /**
         * Base URLs of the service's instances.
         */
        List<String> urls();
    }

    interface RouteConfig {

        String prefix();

        /**
         * Name of the backend service.
         */
        String service();

        /**
         * Replacement for the matched prefix. Absent keeps the path unchanged,
         * {@code /} strips the prefix.
         */
        Optional<String> rewrite();

        @WithDefault("AUTHENTICATED")
        RouteAccess access();

        @WithDefault("general")
        String rateLimitGroup();
    }

    interface JwtConfig {

        /**
         * HMAC secret used to verify token signatures. Never logged.
         */
        String secret();

        /**
         * JWS algorithm: HS256, HS384 or HS512.
         */
        @WithDefault("HS256")
        String algorithm();

        /**
         * Expected {@code iss} claim; not checked when absent.
         */
        Optional<String> issuer();

        @WithDefault("PT30S")
        Duration clockSkew();

        /**
         * How long an administrative revocation is kept when no token expiry is supplied.
         */
        @WithDefault("PT24H")
        Duration revocationTtl();
    }

    interface CircuitBreakerConfig {

        @WithDefault("5")
        int failureThreshold();

        @WithDefault("PT30S")
        Duration resetTimeout();
    }

    interface ProxyConfig {

        @WithDefault("PT5S")
        Duration connectTimeout();

        /**
         * Maximum time to wait for a backend response.
         */
        @WithDefault("PT10S")
        Duration requestTimeout();
    }

    interface StoreConfig {

        @WithDefault("REDIS")
        StoreType type();

        /**
         * Timeout for a single store operation on the request path.
         */
        @WithDefault("PT0.5S")
        Duration operationTimeout();

        /**
         * How often the in-memory stores drop expired entries. Read by the scheduler.
         */
        @WithDefault("PT1M")
        Duration cleanupInterval();
    }

    interface StatusConfig {

        @WithDefault("PT5S")
        Duration probeTimeout();
    }
}
