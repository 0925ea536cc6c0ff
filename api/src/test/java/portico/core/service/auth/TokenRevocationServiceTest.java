package portico.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import portico.support.MutableClock;

@DisplayName("TokenRevocationService")
class TokenRevocationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private TokenRevocationService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        service = new TokenRevocationService(new InMemoryTokenRevocationRepository(clock), clock);
    }

    @Test
    @DisplayName("should keep a revocation until the token expires")
    void shouldKeepRevocationUntilExpiry() {
        service.revoke("jti-1", clock.instant().plusSeconds(600)).await().atMost(TIMEOUT);

        assertTrue(service.isRevoked("jti-1").await().atMost(TIMEOUT));

        clock.advance(Duration.ofSeconds(600));
        assertFalse(service.isRevoked("jti-1").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should skip tokens that have already expired")
    void shouldSkipExpiredTokens() {
        service.revoke("jti-1", clock.instant().minusSeconds(1)).await().atMost(TIMEOUT);

        assertFalse(service.isRevoked("jti-1").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should require an identifier and an expiry")
    void shouldValidateArguments() {
        assertThrows(
                IllegalArgumentException.class,
                () -> service.revoke(" ", clock.instant().plusSeconds(60)).await().atMost(TIMEOUT));
        assertThrows(
                IllegalArgumentException.class,
                () -> service.revoke("jti-1", null).await().atMost(TIMEOUT));
    }
}
