package portico.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.common.StoreUnavailableException;

/**
 * Bounds Redis operations on the request path with a timeout.
 *
 * <p>Timeouts fail with {@link RedisTimeoutException}; any other failure is wrapped in a
 * {@link StoreUnavailableException}. Callers in core decide whether to fail open or closed.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final String repositoryName;

    /**
     * @param timeout        the timeout for each Redis operation
     * @param repositoryName name used in log messages and exceptions
     */
    public RedisTimeoutHelper(Duration timeout, String repositoryName) {
        this.timeout = timeout;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply the timeout to an operation, translating failures to store exceptions.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging
     * @param <T>           the result type
     * @return a Uni that fails with {@link StoreUnavailableException} on timeout or error
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.debugv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    return new RedisTimeoutException(operationName, repositoryName);
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> {
                    LOG.debugv(
                            "Redis operation failure: {0} in {1}: {2}", operationName, repositoryName, error.getMessage());
                    return new StoreUnavailableException(operationName, error);
                });
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * A Redis operation exceeded the configured timeout.
     */
    public static class RedisTimeoutException extends StoreUnavailableException {
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super(operation, null);
            this.repository = repository;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return repository;
        }

        @Override
        public String getMessage() {
            return "Redis operation timeout: " + getOperation() + " in " + repository;
        }
    }
}
