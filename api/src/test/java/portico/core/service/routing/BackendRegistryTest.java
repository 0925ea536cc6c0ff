package portico.core.service.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.core.model.routing.BackendInstance;
import portico.core.model.routing.BackendService;

@DisplayName("BackendRegistry")
class BackendRegistryTest {

    @Test
    @DisplayName("should select among all instances of a service")
    void shouldSelectAmongAllInstances() {
        var first = BackendInstance.of(BackendService.ORDER, "http://order-1:3003");
        var second = BackendInstance.of(BackendService.ORDER, "http://order-2:3003");
        var random = new Random(42);
        var registry = new BackendRegistry(Map.of(BackendService.ORDER, List.of(first, second)), () -> random);

        var seen = new HashSet<BackendInstance>();
        for (int i = 0; i < 100; i++) {
            seen.add(registry.select(BackendService.ORDER).orElseThrow());
        }

        assertEquals(2, seen.size());
    }

    @Test
    @DisplayName("should return empty for a service without instances")
    void shouldReturnEmptyWithoutInstances() {
        var registry = new BackendRegistry(
                Map.of(BackendService.AUTH, List.of(BackendInstance.of(BackendService.AUTH, "http://auth:3001"))),
                Random::new);

        assertTrue(registry.select(BackendService.PRODUCT).isEmpty());
        assertFalse(registry.hasInstances(BackendService.PRODUCT));
        assertTrue(registry.hasInstances(BackendService.AUTH));
    }

    @Test
    @DisplayName("should reject instances registered under another service")
    void shouldRejectMismatchedInstances() {
        var instances = Map.of(
                BackendService.AUTH, List.of(BackendInstance.of(BackendService.ORDER, "http://order:3003")));

        assertThrows(IllegalArgumentException.class, () -> new BackendRegistry(instances, Random::new));
    }

    @Test
    @DisplayName("should resolve paths and queries against the base URL")
    void shouldResolveAgainstBaseUrl() {
        var instance = BackendInstance.of(BackendService.PRODUCT, "http://product:8080/base/");

        assertEquals(
                "http://product:8080/base/api/products?page=2",
                instance.resolve("/api/products", "page=2").toString());
        assertThrows(
                IllegalArgumentException.class, () -> BackendInstance.of(BackendService.PRODUCT, "ftp://product"));
    }
}
