package fr.lapetina.domainreview.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding one reputation source.
 *
 * States:
 * - CLOSED: lookups go through
 * - OPEN: the source failed {@code failureThreshold} times in a row, lookups are skipped
 * - HALF_OPEN: the recovery window elapsed, the next lookup is a probe
 *
 * A successful probe closes the circuit, a failed one reopens it.
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String source;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(String source, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.source = source;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreaker(String source, int failureThreshold, Duration recoveryTimeout) {
        this(source, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    /**
     * Checks if a lookup may be attempted.
     *
     * @return true if the lookup should proceed, false if the circuit is open
     */
    public boolean allowRequest() {
        return switch (getState()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> false;
        };
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
        State previous = state.getAndSet(State.CLOSED);
        if (previous != State.CLOSED) {
            log.info("Circuit breaker CLOSED after recovery: source={}", source);
        }
    }

    public void recordFailure() {
        int failures = consecutiveFailures.incrementAndGet();
        State current = state.get();

        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED (probe failed): source={}", source);
            }
            return;
        }

        if (current == State.CLOSED && failures >= failureThreshold) {
            if (state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED: source={}, consecutiveFailures={}, recovery={}",
                        source, failures, recoveryTimeout);
            }
        }
    }

    public State getState() {
        if (state.get() == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))) {
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                log.info("Circuit breaker transitioning to HALF_OPEN: source={}", source);
            }
        }
        return state.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "source='" + source + '\'' +
                ", state=" + state.get() +
                ", failures=" + consecutiveFailures.get() +
                '}';
    }
}
