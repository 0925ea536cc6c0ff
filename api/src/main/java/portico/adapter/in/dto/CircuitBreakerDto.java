package portico.adapter.in.dto;

import portico.core.model.resilience.CircuitBreakerSnapshot;

/**
 * Administrative view of one circuit breaker.
 *
 * @param lastFailureAt ISO-8601 time of the latest failure, null if none
 */
public record CircuitBreakerDto(
        String service, String state, int failureCount, String lastFailureAt, long rejectedCalls) {

    public static CircuitBreakerDto fromModel(CircuitBreakerSnapshot model) {
        return new CircuitBreakerDto(
                model.service().id(),
                model.state().name(),
                model.failureCount(),
                model.lastFailureAt() != null ? model.lastFailureAt().toString() : null,
                model.rejectedCalls());
    }
}
