package portico.core.model.ratelimit;

/**
 * Counter state after an increment.
 *
 * @param count            requests counted in the current window, including this one
 * @param millisUntilReset time left before the window expires
 */
public record WindowCount(long count, long millisUntilReset) {}
