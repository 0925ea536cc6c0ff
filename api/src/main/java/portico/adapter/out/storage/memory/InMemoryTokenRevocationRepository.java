package portico.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import portico.core.port.out.TokenRevocationRepository;

/**
 * Process-local revocation list for development and tests.
 *
 * <p>Expired entries are dropped when they are next looked up or when
 * {@link #evictExpired()} runs. State is not shared across gateway instances.
 */
public final class InMemoryTokenRevocationRepository implements TokenRevocationRepository {

    private final ConcurrentMap<String, Instant> revoked = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenRevocationRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> revoke(String jti, Instant expiresAt) {
        if (expiresAt.isAfter(clock.instant())) {
            revoked.merge(jti, expiresAt, (existing, requested) -> existing.isAfter(requested) ? existing : requested);
        }
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        var expiresAt = revoked.get(jti);
        if (expiresAt == null) {
            return Uni.createFrom().item(false);
        }
        if (!expiresAt.isAfter(clock.instant())) {
            revoked.remove(jti, expiresAt);
            return Uni.createFrom().item(false);
        }
        return Uni.createFrom().item(true);
    }

    /**
     * @return the number of expired entries removed
     */
    public int evictExpired() {
        var now = clock.instant();
        var before = revoked.size();
        revoked.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
        return Math.max(0, before - revoked.size());
    }

    int size() {
        return revoked.size();
    }
}
