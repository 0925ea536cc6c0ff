package portico.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.smallrye.mutiny.Uni;

import portico.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import portico.core.model.common.StoreUnavailableException;
import portico.core.model.ratelimit.RateLimitOutcome;
import portico.core.model.ratelimit.RateLimitPolicies;
import portico.core.model.ratelimit.RateLimitPolicy;
import portico.core.model.ratelimit.StoreFailureMode;
import portico.core.port.out.RateLimiter;
import portico.support.MutableClock;
import portico.support.RecordingMetrics;

@DisplayName("RateLimitService")
class RateLimitServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private RecordingMetrics metrics;
    private RateLimitPolicies policies;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        metrics = new RecordingMetrics();
        policies = new RateLimitPolicies(
                true,
                Map.of(
                        "auth", new RateLimitPolicy("auth", Duration.ofSeconds(60), 5, StoreFailureMode.FAIL_CLOSED),
                        "general",
                        new RateLimitPolicy("general", Duration.ofSeconds(60), 100, StoreFailureMode.FAIL_OPEN)));
    }

    @Nested
    @DisplayName("Counting")
    class CountingTests {

        private RateLimitService service;

        @BeforeEach
        void setUp() {
            service = new RateLimitService(new InMemoryRateLimiter(clock), policies, clock, metrics);
        }

        @Test
        @DisplayName("should allow five requests per window and reject the sixth")
        void shouldRejectSixthRequest() {
            for (int i = 1; i <= 5; i++) {
                var outcome = service.check("auth", "10.0.0.1").await().atMost(TIMEOUT);
                var allowed = assertInstanceOf(RateLimitOutcome.Allowed.class, outcome);
                assertEquals(5 - i, allowed.decision().remaining());
            }

            clock.advance(Duration.ofSeconds(10));
            var outcome = service.check("auth", "10.0.0.1").await().atMost(TIMEOUT);

            var exceeded = assertInstanceOf(RateLimitOutcome.Exceeded.class, outcome);
            assertEquals("auth", exceeded.group());
            assertFalse(exceeded.decision().allowed());
            assertEquals(50, exceeded.decision().retryAfterSeconds());
            assertEquals(List.of("auth"), metrics.rateLimitExceeded);
        }

        @Test
        @DisplayName("should allow requests again after the window expires")
        void shouldAllowAfterWindowExpires() {
            for (int i = 0; i < 6; i++) {
                service.check("auth", "10.0.0.1").await().atMost(TIMEOUT);
            }

            clock.advance(Duration.ofSeconds(60).plusMillis(1));

            var outcome = service.check("auth", "10.0.0.1").await().atMost(TIMEOUT);
            var allowed = assertInstanceOf(RateLimitOutcome.Allowed.class, outcome);
            assertEquals(4, allowed.decision().remaining());
        }

        @Test
        @DisplayName("should fail on unknown groups")
        void shouldFailOnUnknownGroup() {
            assertThrows(IllegalStateException.class, () -> service.check("unknown", "10.0.0.1"));
        }
    }

    @Nested
    @DisplayName("Global group")
    class GlobalGroupTests {

        private RateLimitService service;

        @BeforeEach
        void setUp() {
            var groups = new HashMap<>(policies.groups());
            groups.put("global", new RateLimitPolicy("global", Duration.ofSeconds(60), 3, StoreFailureMode.FAIL_OPEN));
            service = new RateLimitService(
                    new InMemoryRateLimiter(clock), new RateLimitPolicies(true, groups, "global"), clock, metrics);
        }

        @Test
        @DisplayName("should report the route group's decision while the global group allows")
        void shouldReportRouteDecision() {
            var outcome = service.checkRoute("general", "10.0.0.1").await().atMost(TIMEOUT);

            var allowed = assertInstanceOf(RateLimitOutcome.Allowed.class, outcome);
            assertEquals(100, allowed.decision().limit());
            assertEquals(99, allowed.decision().remaining());
        }

        @Test
        @DisplayName("should reject once the global group is exhausted across routes")
        void shouldRejectAcrossRoutes() {
            service.checkRoute("general", "10.0.0.1").await().atMost(TIMEOUT);
            service.checkRoute("auth", "10.0.0.1").await().atMost(TIMEOUT);
            service.checkRoute("general", "10.0.0.1").await().atMost(TIMEOUT);

            var outcome = service.checkRoute("auth", "10.0.0.1").await().atMost(TIMEOUT);

            var exceeded = assertInstanceOf(RateLimitOutcome.Exceeded.class, outcome);
            assertEquals("global", exceeded.group());
            var authCount = service.check("auth", "10.0.0.1").await().atMost(TIMEOUT);
            assertEquals(3, assertInstanceOf(RateLimitOutcome.Allowed.class, authCount).decision().remaining());
        }
    }

    @Test
    @DisplayName("should allow without counting when rate limiting is disabled")
    void shouldAllowWhenDisabled() {
        var rateLimiter = mock(RateLimiter.class);
        var service = new RateLimitService(
                rateLimiter, new RateLimitPolicies(false, policies.groups()), clock, metrics);

        var outcome = service.check("auth", "10.0.0.1").await().atMost(TIMEOUT);

        var allowed = assertInstanceOf(RateLimitOutcome.Allowed.class, outcome);
        assertNull(allowed.decision());
        verify(rateLimiter, never()).increment(any(), any());
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTests {

        private RateLimitService service;

        @BeforeEach
        void setUp() {
            var rateLimiter = mock(RateLimiter.class);
            when(rateLimiter.increment(any(), any()))
                    .thenReturn(Uni.createFrom()
                            .failure(new StoreUnavailableException("increment", new RuntimeException("down"))));
            service = new RateLimitService(rateLimiter, policies, clock, metrics);
        }

        @Test
        @DisplayName("should let requests through uncounted for fail-open groups")
        void shouldFailOpen() {
            var outcome = service.check("general", "10.0.0.1").await().atMost(TIMEOUT);

            var allowed = assertInstanceOf(RateLimitOutcome.Allowed.class, outcome);
            assertNull(allowed.decision());
            assertEquals(List.of("rate-limiting:increment"), metrics.storeFailures);
        }

        @Test
        @DisplayName("should refuse requests for fail-closed groups")
        void shouldFailClosed() {
            var outcome = service.check("auth", "10.0.0.1").await().atMost(TIMEOUT);

            var unavailable = assertInstanceOf(RateLimitOutcome.StoreUnavailable.class, outcome);
            assertEquals("auth", unavailable.group());
            assertTrue(metrics.rateLimitExceeded.isEmpty());
        }
    }
}
