package portico.core.service.resilience;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import portico.core.model.resilience.CircuitBreakerSettings;
import portico.core.model.resilience.CircuitBreakerSnapshot;
import portico.core.model.resilience.CircuitOpenException;
import portico.core.model.resilience.CircuitState;
import portico.core.model.routing.BackendService;
import portico.core.port.out.Metrics;

/**
 * Circuit breaker guarding calls to one backend service.
 *
 * <p>State transitions:
 * <ul>
 *   <li>CLOSED: calls pass through. A failure increments the failure count, a success
 *       resets it. Reaching the threshold opens the breaker.</li>
 *   <li>OPEN: calls fail with {@link CircuitOpenException} without running. Once the
 *       reset timeout has elapsed since the last failure, the next call becomes the probe
 *       and the breaker is HALF_OPEN.</li>
 *   <li>HALF_OPEN: exactly one probe is in flight; other calls are rejected. A successful
 *       probe closes the breaker, a failed probe re-opens it and restarts the reset clock.</li>
 * </ul>
 *
 * <p>All state lives in one immutable value behind an {@link AtomicReference} and every
 * transition is a compare-and-set, so concurrent outcomes cannot both flip the state.
 */
public final class CircuitBreaker {

    private static final Logger LOG = Logger.getLogger(CircuitBreaker.class);

    private static final State INITIAL = new State(CircuitState.CLOSED, 0, 0L);

    private final BackendService service;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final Metrics metrics;
    private final AtomicReference<State> state = new AtomicReference<>(INITIAL);
    private final AtomicLong rejectedCalls = new AtomicLong();

    public CircuitBreaker(BackendService service, CircuitBreakerSettings settings, Clock clock, Metrics metrics) {
        this.service = service;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Run a call through the breaker.
     *
     * <p>The call is only started when the breaker admits it. Failed Unis count as
     * failures, as do items for which {@code isFailure} returns true; those items are
     * still delivered to the caller.
     *
     * @param call      produces the guarded operation
     * @param isFailure classifies successful items that should count as failures
     * @return the call's outcome, or a failure with {@link CircuitOpenException}
     */
    public <T> Uni<T> execute(Supplier<Uni<T>> call, Predicate<T> isFailure) {
        return Uni.createFrom().deferred(() -> {
            var permit = acquirePermit();
            if (permit == Permit.REJECTED) {
                rejectedCalls.incrementAndGet();
                metrics.recordCircuitRejection(service);
                return Uni.createFrom().failure(new CircuitOpenException(service, retryAfterSeconds()));
            }

            Uni<T> guarded;
            try {
                guarded = call.get();
            } catch (RuntimeException e) {
                onFailure(permit);
                return Uni.createFrom().failure(e);
            }

            var completed = new AtomicBoolean();
            return guarded.invoke(item -> {
                        if (completed.compareAndSet(false, true)) {
                            if (isFailure.test(item)) {
                                onFailure(permit);
                            } else {
                                onSuccess(permit);
                            }
                        }
                    })
                    .onFailure()
                    .invoke(error -> {
                        if (completed.compareAndSet(false, true)) {
                            onFailure(permit);
                        }
                    })
                    .onCancellation()
                    .invoke(() -> {
                        if (completed.compareAndSet(false, true)) {
                            onCancelled(permit);
                        }
                    });
        });
    }

    public <T> Uni<T> execute(Supplier<Uni<T>> call) {
        return execute(call, item -> false);
    }

    public BackendService service() {
        return service;
    }

    public CircuitState state() {
        return state.get().circuit();
    }

    public CircuitBreakerSnapshot snapshot() {
        var current = state.get();
        var lastFailure = current.lastFailureMillis() == 0L ? null : Instant.ofEpochMilli(current.lastFailureMillis());
        return new CircuitBreakerSnapshot(
                service, current.circuit(), current.failures(), lastFailure, rejectedCalls.get());
    }

    /**
     * Force the breaker to CLOSED with a zero failure count.
     */
    public void reset() {
        var previous = state.getAndSet(INITIAL);
        if (previous.circuit() != CircuitState.CLOSED) {
            LOG.infov("Circuit breaker for {0} reset manually from {1}", service.id(), previous.circuit());
            metrics.recordCircuitTransition(service, previous.circuit(), CircuitState.CLOSED);
        }
    }

    private Permit acquirePermit() {
        while (true) {
            var current = state.get();
            switch (current.circuit()) {
                case CLOSED:
                    return Permit.NORMAL;
                case HALF_OPEN:
                    return Permit.REJECTED;
                case OPEN:
                default:
                    if (!resetTimeoutElapsed(current)) {
                        return Permit.REJECTED;
                    }
                    var probing = new State(CircuitState.HALF_OPEN, current.failures(), current.lastFailureMillis());
                    if (state.compareAndSet(current, probing)) {
                        transitioned(CircuitState.OPEN, CircuitState.HALF_OPEN);
                        return Permit.PROBE;
                    }
            }
        }
    }

    private void onSuccess(Permit permit) {
        while (true) {
            var current = state.get();
            State next;
            if (permit == Permit.PROBE) {
                if (current.circuit() != CircuitState.HALF_OPEN) {
                    return;
                }
                next = new State(CircuitState.CLOSED, 0, current.lastFailureMillis());
            } else {
                // Late results from calls admitted before the breaker opened do not close it
                if (current.circuit() != CircuitState.CLOSED || current.failures() == 0) {
                    return;
                }
                next = new State(CircuitState.CLOSED, 0, current.lastFailureMillis());
            }
            if (state.compareAndSet(current, next)) {
                if (permit == Permit.PROBE) {
                    transitioned(CircuitState.HALF_OPEN, CircuitState.CLOSED);
                }
                return;
            }
        }
    }

    private void onFailure(Permit permit) {
        while (true) {
            var current = state.get();
            var now = clock.millis();
            State next;
            if (permit == Permit.PROBE) {
                if (current.circuit() != CircuitState.HALF_OPEN) {
                    return;
                }
                next = new State(CircuitState.OPEN, current.failures(), now);
            } else {
                if (current.circuit() != CircuitState.CLOSED) {
                    return;
                }
                var failures = current.failures() + 1;
                var circuit = failures >= settings.failureThreshold() ? CircuitState.OPEN : CircuitState.CLOSED;
                next = new State(circuit, failures, now);
            }
            if (state.compareAndSet(current, next)) {
                if (current.circuit() != next.circuit()) {
                    transitioned(current.circuit(), next.circuit());
                }
                return;
            }
        }
    }

    private void onCancelled(Permit permit) {
        if (permit != Permit.PROBE) {
            return;
        }
        // The probe never reported; go back to OPEN so the next call can probe again
        while (true) {
            var current = state.get();
            if (current.circuit() != CircuitState.HALF_OPEN) {
                return;
            }
            var next = new State(CircuitState.OPEN, current.failures(), current.lastFailureMillis());
            if (state.compareAndSet(current, next)) {
                LOG.debugf("Probe for %s was cancelled, circuit back to OPEN", service.id());
                return;
            }
        }
    }

    private boolean resetTimeoutElapsed(State current) {
        return clock.millis() - current.lastFailureMillis() >= settings.resetTimeout().toMillis();
    }

    private long retryAfterSeconds() {
        var current = state.get();
        var remainingMillis = settings.resetTimeout().toMillis() - (clock.millis() - current.lastFailureMillis());
        return Math.max(1, (remainingMillis + 999) / 1000);
    }

    private void transitioned(CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            LOG.warnv(
                    "Circuit breaker for {0} opened ({1} -> OPEN) after {2} failures, retry in {3}",
                    service.id(), from, state.get().failures(), settings.resetTimeout());
        } else {
            LOG.infov("Circuit breaker for {0}: {1} -> {2}", service.id(), from, to);
        }
        metrics.recordCircuitTransition(service, from, to);
    }

    private enum Permit {
        NORMAL,
        PROBE,
        REJECTED
    }

    private record State(CircuitState circuit, int failures, long lastFailureMillis) {}
}
