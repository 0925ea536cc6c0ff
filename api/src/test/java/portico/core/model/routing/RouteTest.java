package portico.core.model.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Route")
class RouteTest {

    @Nested
    @DisplayName("Prefix matching")
    class MatchingTests {

        private final Route route = new Route("/api/orders", BackendService.ORDER, "/", RouteAccess.AUTHENTICATED, "general");

        @Test
        @DisplayName("should match the prefix itself and paths below it")
        void shouldMatchPrefixAndChildren() {
            assertTrue(route.matches("/api/orders"));
            assertTrue(route.matches("/api/orders/"));
            assertTrue(route.matches("/api/orders/42/items"));
        }

        @Test
        @DisplayName("should not match a longer segment sharing the prefix")
        void shouldNotMatchPartialSegment() {
            assertFalse(route.matches("/api/ordersx"));
            assertFalse(route.matches("/api/order"));
            assertFalse(route.matches(null));
        }
    }

    @Nested
    @DisplayName("Path rewriting")
    class RewriteTests {

        @Test
        @DisplayName("should strip the prefix when rewrite is /")
        void shouldStripPrefix() {
            var route = new Route("/api/orders", BackendService.ORDER, "/", RouteAccess.AUTHENTICATED, "general");

            assertEquals("/42", route.rewritePath("/api/orders/42"));
            assertEquals("/", route.rewritePath("/api/orders"));
        }

        @Test
        @DisplayName("should keep the prefix when no rewrite is configured")
        void shouldKeepPrefixByDefault() {
            var route = new Route("/api/products", BackendService.PRODUCT, null, RouteAccess.PUBLIC_READ, "general");

            assertEquals("/api/products/7", route.rewritePath("/api/products/7"));
        }

        @Test
        @DisplayName("should replace the prefix with the rewrite target")
        void shouldReplacePrefix() {
            var route = new Route("/api/auth", BackendService.AUTH, "/v1/auth/", RouteAccess.PUBLIC, "auth");

            assertEquals("/v1/auth/login", route.rewritePath("/api/auth/login"));
        }
    }

    @Test
    @DisplayName("should normalize prefixes and reject blank ones")
    void shouldNormalizePrefix() {
        var route = new Route("api/auth/", BackendService.AUTH, "/", RouteAccess.PUBLIC, "auth");

        assertEquals("/api/auth", route.prefix());
        assertThrows(
                IllegalArgumentException.class,
                () -> new Route(" ", BackendService.AUTH, null, RouteAccess.PUBLIC, "auth"));
    }

    @Test
    @DisplayName("PUBLIC_READ should only require authentication for mutations")
    void publicReadShouldRequireAuthForMutations() {
        assertFalse(RouteAccess.PUBLIC_READ.requiresAuthentication("GET"));
        assertFalse(RouteAccess.PUBLIC_READ.requiresAuthentication("head"));
        assertTrue(RouteAccess.PUBLIC_READ.requiresAuthentication("POST"));
        assertTrue(RouteAccess.AUTHENTICATED.requiresAuthentication("GET"));
        assertFalse(RouteAccess.PUBLIC.requiresAuthentication("DELETE"));
    }
}
