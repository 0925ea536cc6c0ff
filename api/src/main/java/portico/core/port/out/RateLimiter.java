package portico.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import portico.core.model.ratelimit.RateLimitKey;
import portico.core.model.ratelimit.WindowCount;

/**
 * Fixed-window counter store.
 */
public interface RateLimiter {

    /**
     * Atomically increment the counter for a key, starting a new window of the given
     * length when none is active.
     *
     * @param key    the counter key
     * @param window the window length, applied when the increment starts a window
     * @return the count after the increment and the time left in the window
     */
    Uni<WindowCount> increment(RateLimitKey key, Duration window);
}
