package portico.core.model.ratelimit;

/**
 * Outcome of applying a group's rate limit to a request.
 */
public sealed interface RateLimitOutcome {

    /**
     * The request may proceed.
     *
     * @param decision the counter state, null when the request was not counted
     *                 (rate limiting disabled or store unavailable under fail-open)
     */
    record Allowed(RateLimitDecision decision) implements RateLimitOutcome {}

    record Exceeded(String group, RateLimitDecision decision) implements RateLimitOutcome {}

    /**
     * The counter store failed and the group is configured to fail closed.
     */
    record StoreUnavailable(String group) implements RateLimitOutcome {}
}
