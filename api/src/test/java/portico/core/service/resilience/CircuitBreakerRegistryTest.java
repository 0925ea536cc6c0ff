package portico.core.service.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.smallrye.mutiny.Uni;

import portico.core.model.resilience.CircuitBreakerSettings;
import portico.core.model.resilience.CircuitState;
import portico.core.model.routing.BackendService;
import portico.support.MutableClock;
import portico.support.RecordingMetrics;

@DisplayName("CircuitBreakerRegistry")
class CircuitBreakerRegistryTest {

    private final CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
            new CircuitBreakerSettings(1, Duration.ofSeconds(30)),
            MutableClock.startingAt("2024-01-01T00:00:00Z"),
            new RecordingMetrics());

    @Test
    @DisplayName("should keep one independent breaker per service")
    void shouldKeepIndependentBreakers() {
        var order = registry.forService(BackendService.ORDER);

        assertSame(order, registry.forService(BackendService.ORDER));
        assertNotSame(order, registry.forService(BackendService.PRODUCT));

        assertThrows(IllegalStateException.class, () -> order.execute(
                        () -> Uni.createFrom().<String>failure(new IllegalStateException("down")))
                .await()
                .atMost(Duration.ofSeconds(1)));

        assertEquals(CircuitState.OPEN, registry.forService(BackendService.ORDER).state());
        assertEquals(CircuitState.CLOSED, registry.forService(BackendService.PRODUCT).state());
        assertEquals(BackendService.values().length, registry.snapshots().size());
    }

    @Test
    @DisplayName("reset should return the closed snapshot")
    void resetShouldReturnClosedSnapshot() {
        var order = registry.forService(BackendService.ORDER);
        assertThrows(IllegalStateException.class, () -> order.execute(
                        () -> Uni.createFrom().<String>failure(new IllegalStateException("down")))
                .await()
                .atMost(Duration.ofSeconds(1)));

        var snapshot = registry.reset(BackendService.ORDER);

        assertEquals(CircuitState.CLOSED, snapshot.state());
        assertEquals(0, snapshot.failureCount());
    }
}
