package portico.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.ratelimit.RateLimitKey;
import portico.core.model.ratelimit.WindowCount;
import portico.core.port.out.RateLimiter;

/**
 * In-memory fixed window counters.
 *
 * <p>Suitable for single-instance deployments or development/testing. Limitations:
 * <ul>
 *   <li>State is not shared across instances</li>
 *   <li>State is lost on restart</li>
 * </ul>
 *
 * <p>A window covers {@code [start, start + window]}; the first request strictly after
 * that starts a new one. Expired windows stay in memory until {@link #evictExpired()} runs.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimiter.class);

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<WindowCount> increment(RateLimitKey key, Duration window) {
        var now = clock.millis();
        var windowMillis = window.toMillis();

        // Atomic compute to handle concurrent requests
        var updated = windows.compute(key.toCacheKey(), (k, current) -> {
            if (current == null || now > current.expiresAtMillis()) {
                return new Window(1, now + windowMillis);
            }
            return new Window(current.count() + 1, current.expiresAtMillis());
        });

        return Uni.createFrom().item(new WindowCount(updated.count(), updated.expiresAtMillis() - now));
    }

    /**
     * Remove windows that have expired.
     *
     * @return the number of windows removed
     */
    public int evictExpired() {
        var now = clock.millis();
        var before = windows.size();
        windows.entrySet().removeIf(entry -> now > entry.getValue().expiresAtMillis());
        var removed = before - windows.size();
        if (removed > 0) {
            LOG.debugf("Evicted %d expired rate limit windows", removed);
        }
        return Math.max(0, removed);
    }

    /**
     * Returns the number of tracked windows.
     */
    public int getWindowCount() {
        return windows.size();
    }

    private record Window(long count, long expiresAtMillis) {}
}
