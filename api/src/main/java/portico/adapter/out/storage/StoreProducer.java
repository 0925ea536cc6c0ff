package portico.adapter.out.storage;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import portico.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import portico.adapter.out.ratelimit.redis.RedisRateLimiter;
import portico.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import portico.adapter.out.storage.redis.RedisTokenRevocationRepository;
import portico.config.GatewayConfig;
import portico.config.StoreType;
import portico.core.port.out.RateLimiter;
import portico.core.port.out.TokenRevocationRepository;

/**
 * CDI producer for the shared-store adapters.
 *
 * <p>Selects Redis or in-memory implementations of the rate limit counters and the
 * revocation list from {@code portico.store.type}. Redis is required in multi-instance
 * deployments; there is no silent fallback to in-memory state.
 *
 * <p>Redis expires windows and revocations itself. The in-memory stores are swept on
 * {@code portico.store.cleanup-interval}.
 */
@ApplicationScoped
public class StoreProducer {

    private static final Logger LOG = Logger.getLogger(StoreProducer.class);

    private final GatewayConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Clock clock;

    private volatile InMemoryRateLimiter inMemoryRateLimiter;
    private volatile InMemoryTokenRevocationRepository inMemoryRevocations;

    @Inject
    public StoreProducer(GatewayConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.clock = clock;
    }

    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (config.store().type() == StoreType.MEMORY) {
            LOG.info("Using in-memory rate limit counters (single instance only)");
            inMemoryRateLimiter = new InMemoryRateLimiter(clock);
            return inMemoryRateLimiter;
        }
        LOG.infov("Using Redis rate limit counters (timeout {0})", config.store().operationTimeout());
        return new RedisRateLimiter(requireRedis(), config.store().operationTimeout());
    }

    @Produces
    @ApplicationScoped
    public TokenRevocationRepository produceTokenRevocationRepository() {
        if (config.store().type() == StoreType.MEMORY) {
            LOG.info("Using in-memory token revocation list (single instance only)");
            inMemoryRevocations = new InMemoryTokenRevocationRepository(clock);
            return inMemoryRevocations;
        }
        return new RedisTokenRevocationRepository(requireRedis(), config.store().operationTimeout(), clock);
    }

    /**
     * Remove expired rate limit windows and revocations from the in-memory stores.
     * Does nothing when Redis is in use.
     */
    @Scheduled(
            every = "${portico.store.cleanup-interval:PT1M}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void evictExpiredEntries() {
        var limiter = inMemoryRateLimiter;
        var revocations = inMemoryRevocations;
        var windows = limiter != null ? limiter.evictExpired() : 0;
        var tokens = revocations != null ? revocations.evictExpired() : 0;
        if (windows > 0 || tokens > 0) {
            LOG.debugv("Evicted {0} rate limit windows and {1} revocations", windows, tokens);
        }
    }

    private ReactiveRedisDataSource requireRedis() {
        if (!redisDataSource.isResolvable()) {
            throw new IllegalStateException(
                    "portico.store.type=REDIS but no Redis data source is available; set quarkus.redis.hosts");
        }
        return redisDataSource.get();
    }
}
