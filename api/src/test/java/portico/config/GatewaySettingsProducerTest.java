package portico.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import portico.core.model.ratelimit.RateLimitPolicies;
import portico.core.model.ratelimit.StoreFailureMode;
import portico.core.model.routing.BackendService;
import portico.core.model.routing.RouteAccess;
import portico.core.service.routing.BackendRegistry;

@DisplayName("GatewaySettingsProducer")
class GatewaySettingsProducerTest {

    record Backend(List<String> urls) implements GatewayConfig.BackendConfig {}

    record RouteEntry(String prefix, String service, Optional<String> rewrite, RouteAccess access, String rateLimitGroup)
            implements GatewayConfig.RouteConfig {}

    record Group(Duration window, long maxRequests, StoreFailureMode onStoreFailure)
            implements RateLimitingConfig.GroupConfig {}

    record RateLimiting(boolean enabled, Map<String, RateLimitingConfig.GroupConfig> groups, Optional<String> globalGroup)
            implements RateLimitingConfig {}

    private static final RateLimiting RATE_LIMITING = new RateLimiting(
            true,
            Map.of(
                    "auth", new Group(Duration.ofMinutes(15), 5, StoreFailureMode.FAIL_CLOSED),
                    "general", new Group(Duration.ofMinutes(15), 100, StoreFailureMode.FAIL_OPEN),
                    "global", new Group(Duration.ofMinutes(15), 1000, StoreFailureMode.FAIL_OPEN)),
            Optional.of("global"));

    private static BackendRegistry registry(Map<String, GatewayConfig.BackendConfig> backends) {
        return new BackendRegistry(GatewaySettingsProducer.backendInstances(backends), Random::new);
    }

    private static RateLimitPolicies policies() {
        return GatewaySettingsProducer.buildRateLimitPolicies(RATE_LIMITING);
    }

    @Nested
    @DisplayName("Backends")
    class BackendTests {

        @Test
        @DisplayName("should parse comma separated instance lists")
        void shouldParseInstances() {
            var registry = registry(Map.of("order", new Backend(List.of("http://order-1:3003", " http://order-2:3003 "))));

            assertEquals(2, registry.instancesOf(BackendService.ORDER).size());
        }

        @Test
        @DisplayName("should reject unknown services and malformed URLs")
        void shouldRejectInvalidBackends() {
            var unknown = assertThrows(
                    IllegalStateException.class,
                    () -> GatewaySettingsProducer.backendInstances(
                            Map.of("billing", new Backend(List.of("http://billing:80")))));
            assertTrue(unknown.getMessage().contains("portico.backends.billing.urls"));

            var malformed = assertThrows(
                    IllegalStateException.class,
                    () -> GatewaySettingsProducer.backendInstances(
                            Map.of("order", new Backend(List.of("order-service:3003")))));
            assertTrue(malformed.getMessage().contains("portico.backends.order.urls"));
        }
    }

    @Nested
    @DisplayName("Routes")
    class RouteTests {

        private final BackendRegistry registry = registry(Map.of(
                "auth", new Backend(List.of("http://auth:3001")),
                "order", new Backend(List.of("http://order:3003"))));

        @Test
        @DisplayName("should build the route table")
        void shouldBuildRouteTable() {
            var table = GatewaySettingsProducer.buildRouteTable(
                    List.of(
                            new RouteEntry("/api/auth", "auth", Optional.of("/"), RouteAccess.PUBLIC, "auth"),
                            new RouteEntry("/api/orders", "order", Optional.of("/"), RouteAccess.AUTHENTICATED, "general")),
                    registry,
                    policies());

            assertEquals(List.of("/api/auth", "/api/orders"), table.prefixes());
            assertEquals("/login", table.match("/api/auth/login").orElseThrow().rewrittenPath());
        }

        @Test
        @DisplayName("should reject routes to services without instances")
        void shouldRejectServiceWithoutInstances() {
            var error = assertThrows(
                    IllegalStateException.class,
                    () -> GatewaySettingsProducer.buildRouteTable(
                            List.of(new RouteEntry(
                                    "/api/products", "product", Optional.empty(), RouteAccess.PUBLIC_READ, "general")),
                            registry,
                            policies()));

            assertTrue(error.getMessage().contains("portico.routes[0]"));
        }

        @Test
        @DisplayName("should reject unknown rate limit groups")
        void shouldRejectUnknownGroup() {
            var error = assertThrows(
                    IllegalStateException.class,
                    () -> GatewaySettingsProducer.buildRouteTable(
                            List.of(new RouteEntry("/api/auth", "auth", Optional.of("/"), RouteAccess.PUBLIC, "burst")),
                            registry,
                            policies()));

            assertTrue(error.getMessage().contains("portico.routes[0].rate-limit-group"));
        }

        @Test
        @DisplayName("should reject duplicate prefixes")
        void shouldRejectDuplicatePrefixes() {
            assertThrows(
                    IllegalStateException.class,
                    () -> GatewaySettingsProducer.buildRouteTable(
                            List.of(
                                    new RouteEntry("/api/auth", "auth", Optional.of("/"), RouteAccess.PUBLIC, "auth"),
                                    new RouteEntry("/api/auth/", "order", Optional.of("/"), RouteAccess.PUBLIC, "auth")),
                            registry,
                            policies()));
        }
    }

    @Test
    @DisplayName("should build rate limit policies and reject invalid groups")
    void shouldBuildRateLimitPolicies() {
        var policies = policies();

        assertTrue(policies.enabled());
        assertEquals(5, policies.forGroup("auth").orElseThrow().maxRequests());
        assertEquals(StoreFailureMode.FAIL_OPEN, policies.forGroup("general").orElseThrow().onStoreFailure());
        assertFalse(policies.forGroup("burst").isPresent());

        assertEquals("global", policies.global().orElseThrow().group());

        var invalid = new RateLimiting(
                true,
                Map.of("auth", new Group(Duration.ofMinutes(15), 0, StoreFailureMode.FAIL_OPEN)),
                Optional.empty());
        var error = assertThrows(IllegalStateException.class, () -> GatewaySettingsProducer.buildRateLimitPolicies(invalid));
        assertTrue(error.getMessage().contains("portico.rate-limiting.groups.auth"));

        var unknownGlobal = new RateLimiting(
                true,
                Map.of("auth", new Group(Duration.ofMinutes(15), 5, StoreFailureMode.FAIL_OPEN)),
                Optional.of("everything"));
        var globalError = assertThrows(
                IllegalStateException.class, () -> GatewaySettingsProducer.buildRateLimitPolicies(unknownGlobal));
        assertTrue(globalError.getMessage().contains("portico.rate-limiting.global-group"));
    }

    @Test
    @DisplayName("should report the trusted proxies property when an entry is malformed")
    void shouldValidateTrustedProxies() {
        assertTrue(GatewaySettingsProducer.buildTrustedProxies(Optional.empty()).isEmpty());
        assertTrue(GatewaySettingsProducer.buildTrustedProxies(Optional.of(List.of("10.0.0.0/8")))
                .isTrusted("10.1.2.3"));

        var error = assertThrows(
                IllegalStateException.class,
                () -> GatewaySettingsProducer.buildTrustedProxies(Optional.of(List.of("10.0.0.0/40"))));
        assertTrue(error.getMessage().contains("portico.trusted-proxies"));
    }
}
