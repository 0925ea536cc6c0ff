package portico.core.model.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds shared by every backend circuit breaker.
 *
 * @param failureThreshold consecutive failures that open the breaker
 * @param resetTimeout     time after the last failure before a probe is allowed
 */
public record CircuitBreakerSettings(int failureThreshold, Duration resetTimeout) {

    public CircuitBreakerSettings {
        Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1, got " + failureThreshold);
        }
        if (resetTimeout.isNegative() || resetTimeout.isZero()) {
            throw new IllegalArgumentException("resetTimeout must be positive");
        }
    }
}
