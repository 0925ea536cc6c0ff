package portico.core.model.ratelimit;

/**
 * What a rate limit group does when the counter store cannot be reached.
 */
public enum StoreFailureMode {

    /** Allow the request without counting it. */
    FAIL_OPEN,

    /** Reject the request as store unavailable. */
    FAIL_CLOSED
}
