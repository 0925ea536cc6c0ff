package portico.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import portico.support.MutableClock;

@DisplayName("InMemoryTokenRevocationRepository")
class InMemoryTokenRevocationRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryTokenRevocationRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        repository = new InMemoryTokenRevocationRepository(clock);
    }

    @Test
    @DisplayName("should drop entries lazily once they expire")
    void shouldDropExpiredEntries() {
        repository.revoke("jti-1", clock.instant().plusSeconds(60)).await().atMost(TIMEOUT);
        assertEquals(1, repository.size());

        clock.advance(Duration.ofSeconds(60));

        assertFalse(repository.isRevoked("jti-1").await().atMost(TIMEOUT));
        assertEquals(0, repository.size());
    }

    @Test
    @DisplayName("should keep the later expiry when a token is revoked twice")
    void shouldKeepLaterExpiry() {
        repository.revoke("jti-1", clock.instant().plusSeconds(120)).await().atMost(TIMEOUT);
        repository.revoke("jti-1", clock.instant().plusSeconds(30)).await().atMost(TIMEOUT);

        clock.advance(Duration.ofSeconds(60));

        assertTrue(repository.isRevoked("jti-1").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should ignore entries that are already expired")
    void shouldIgnoreExpiredEntries() {
        repository.revoke("jti-1", clock.instant()).await().atMost(TIMEOUT);

        assertEquals(0, repository.size());
    }
}
