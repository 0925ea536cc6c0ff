package portico.adapter.out.ratelimit.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import portico.adapter.out.storage.redis.RedisTimeoutHelper;
import portico.core.model.ratelimit.RateLimitKey;
import portico.core.model.ratelimit.WindowCount;
import portico.core.port.out.RateLimiter;

/**
 * Redis-based fixed window counters for multi-instance deployments.
 *
 * <p>The increment and the window expiry are applied atomically by a Lua script, so all
 * gateway instances share one count per key. Failures and timeouts propagate as
 * {@code StoreUnavailableException}; the caller applies the group's failure mode.
 *
 * <p>Key format: {@code portico:ratelimit:{group}:{clientId}}
 */
public final class RedisRateLimiter implements RateLimiter {

    /**
     * Lua script for an atomic fixed window increment.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - window length in milliseconds</li>
     * </ol>
     *
     * <p>Returns array: [count, millis_until_reset]
     */
    static final String FIXED_WINDOW_SCRIPT =
            """
            local key = KEYS[1]
            local window_ms = tonumber(ARGV[1])

            local count = redis.call('INCR', key)
            if count == 1 then
                redis.call('PEXPIRE', key, window_ms)
            end

            -- A counter without expiry would never reset
            local ttl = redis.call('PTTL', key)
            if ttl < 0 then
                redis.call('PEXPIRE', key, window_ms)
                ttl = window_ms
            end

            return {count, ttl}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisRateLimiter(ReactiveRedisDataSource redisDataSource, Duration operationTimeout) {
        this.redisDataSource = redisDataSource;
        this.timeoutHelper = new RedisTimeoutHelper(operationTimeout, "rate-limiting");
    }

    @Override
    public Uni<WindowCount> increment(RateLimitKey key, Duration window) {
        // EVAL script numkeys key [key...] arg [arg...]
        var eval = redisDataSource
                .execute(
                        "EVAL",
                        FIXED_WINDOW_SCRIPT,
                        "1", // numkeys
                        key.toCacheKey(), // KEYS[1]
                        String.valueOf(window.toMillis()) // ARGV[1]
                        )
                .map(this::parseResponse);
        return timeoutHelper.withTimeout(eval, "increment");
    }

    private WindowCount parseResponse(Response response) {
        if (response == null || response.size() < 2) {
            throw new IllegalStateException("Unexpected response from rate limit script: " + response);
        }
        return new WindowCount(response.get(0).toLong(), response.get(1).toLong());
    }
}
