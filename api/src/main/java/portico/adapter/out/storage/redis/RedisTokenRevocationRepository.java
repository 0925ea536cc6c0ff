package portico.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.port.out.TokenRevocationRepository;

/**
 * Redis implementation of TokenRevocationRepository.
 *
 * <p>Revocation entries are stored with a TTL matching the token's remaining lifetime.
 *
 * <p>Key format: {@code portico:revoked:jti:{jti}}
 */
public class RedisTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(RedisTokenRevocationRepository.class);

    static final String JTI_PREFIX = "portico:revoked:jti:";
    private static final String REVOKED_VALUE = "1";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final Clock clock;

    public RedisTokenRevocationRepository(
            ReactiveRedisDataSource redisDataSource, Duration operationTimeout, Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = new RedisTimeoutHelper(operationTimeout, "token-revocation");
        this.clock = clock;
        LOG.info("Initialized Redis token revocation repository");
    }

    @Override
    public Uni<Void> revoke(String jti, Instant expiresAt) {
        var key = JTI_PREFIX + jti;
        var ttlSeconds = Duration.between(clock.instant(), expiresAt).toSeconds();

        if (ttlSeconds <= 0) {
            LOG.debugf("Skipping revocation for already-expired token: %s", jti);
            return Uni.createFrom().voidItem();
        }

        return timeoutHelper
                .withTimeout(valueCommands.setex(key, ttlSeconds, REVOKED_VALUE), "revoke")
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Revoked token in Redis: %s (TTL: %ds)", jti, ttlSeconds));
    }

    @Override
    public Uni<Boolean> isRevoked(String jti) {
        return timeoutHelper.withTimeout(keyCommands.exists(JTI_PREFIX + jti), "isRevoked");
    }
}
