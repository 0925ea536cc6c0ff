package portico.config;

/**
 * Backing store for rate limit counters and the token revocation list.
 */
public enum StoreType {

    /** Shared Redis store; correct across gateway instances. */
    REDIS,

    /** Process-local maps for development and tests. */
    MEMORY
}
