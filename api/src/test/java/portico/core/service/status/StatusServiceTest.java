package portico.core.service.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.smallrye.mutiny.Uni;

import portico.core.model.resilience.CircuitBreakerSettings;
import portico.core.model.resilience.CircuitState;
import portico.core.model.routing.BackendInstance;
import portico.core.model.routing.BackendService;
import portico.core.model.status.GatewayStatus;
import portico.core.model.status.InstanceStatus;
import portico.core.model.status.ServiceStatus;
import portico.core.port.out.BackendHealthProbe;
import portico.core.service.resilience.CircuitBreakerRegistry;
import portico.core.service.routing.BackendRegistry;
import portico.support.MutableClock;
import portico.support.RecordingMetrics;

@DisplayName("StatusService")
class StatusServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private BackendHealthProbe probe;
    private CircuitBreakerRegistry circuitBreakers;

    @BeforeEach
    void setUp() {
        probe = mock(BackendHealthProbe.class);
        circuitBreakers = new CircuitBreakerRegistry(
                new CircuitBreakerSettings(5, Duration.ofSeconds(30)), clock, new RecordingMetrics());
        when(probe.probe(any())).thenAnswer(invocation -> {
            BackendInstance instance = invocation.getArgument(0);
            return Uni.createFrom().item(InstanceStatus.up(instance.baseUri().toString(), 200, "1.0.0"));
        });
    }

    private StatusService service(Map<BackendService, List<BackendInstance>> instances) {
        return new StatusService(new BackendRegistry(instances, Random::new), probe, circuitBreakers, clock);
    }

    private static ServiceStatus find(GatewayStatus status, BackendService service) {
        return status.services().stream()
                .filter(s -> s.service() == service)
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("should report healthy when every instance is up")
    void shouldReportHealthy() {
        var status = service(Map.of(
                        BackendService.AUTH, List.of(BackendInstance.of(BackendService.AUTH, "http://auth:3001")),
                        BackendService.PRODUCT, List.of(BackendInstance.of(BackendService.PRODUCT, "http://product:8080")),
                        BackendService.ORDER, List.of(
                                BackendInstance.of(BackendService.ORDER, "http://order-1:3003"),
                                BackendInstance.of(BackendService.ORDER, "http://order-2:3003"))))
                .checkStatus()
                .await()
                .atMost(TIMEOUT);

        assertTrue(status.healthy());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), status.checkedAt());
        assertEquals(BackendService.values().length, status.services().size());
        assertEquals(2, find(status, BackendService.ORDER).instances().size());
        assertEquals(CircuitState.CLOSED, find(status, BackendService.ORDER).circuit());
    }

    @Test
    @DisplayName("should report degraded when an instance is down")
    void shouldReportDegraded() {
        var down = BackendInstance.of(BackendService.ORDER, "http://order-2:3003");
        when(probe.probe(down)).thenReturn(Uni.createFrom().item(
                InstanceStatus.down("http://order-2:3003", null, "Connection refused")));

        var status = service(Map.of(
                        BackendService.AUTH, List.of(BackendInstance.of(BackendService.AUTH, "http://auth:3001")),
                        BackendService.PRODUCT, List.of(BackendInstance.of(BackendService.PRODUCT, "http://product:8080")),
                        BackendService.ORDER, List.of(BackendInstance.of(BackendService.ORDER, "http://order-1:3003"), down)))
                .checkStatus()
                .await()
                .atMost(TIMEOUT);

        assertFalse(status.healthy());
        assertFalse(find(status, BackendService.ORDER).healthy());
        assertTrue(find(status, BackendService.AUTH).healthy());
    }

    @Test
    @DisplayName("should treat a service without instances as unhealthy")
    void shouldTreatMissingInstancesAsUnhealthy() {
        var status = service(Map.of(
                        BackendService.AUTH, List.of(BackendInstance.of(BackendService.AUTH, "http://auth:3001"))))
                .checkStatus()
                .await()
                .atMost(TIMEOUT);

        assertFalse(status.healthy());
        assertTrue(find(status, BackendService.PRODUCT).instances().isEmpty());
    }

    @Test
    @DisplayName("should include the circuit state of each service")
    void shouldIncludeCircuitState() {
        var breaker = circuitBreakers.forService(BackendService.AUTH);
        for (var i = 0; i < 5; i++) {
            breaker.execute(() -> Uni.createFrom().<String>failure(new IllegalStateException("down")))
                    .onFailure()
                    .recoverWithItem("recovered")
                    .await()
                    .atMost(TIMEOUT);
        }

        var status = service(Map.of(
                        BackendService.AUTH, List.of(BackendInstance.of(BackendService.AUTH, "http://auth:3001"))))
                .checkStatus()
                .await()
                .atMost(TIMEOUT);

        assertEquals(CircuitState.OPEN, find(status, BackendService.AUTH).circuit());
        assertEquals(CircuitState.CLOSED, find(status, BackendService.ORDER).circuit());
    }
}
