package com.lms.fallback.resilience;

import com.lms.fallback.config.CircuitBreakerConfig;
import com.lms.fallback.model.CircuitBreakerState;
import com.lms.fallback.model.CircuitStateListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consecutive-failure circuit breaker guarding the primary store.
 *
 * <pre>
 *     CLOSED ──(failures >= failureThreshold)──> OPEN
 *        ^                                         │
 *        │                               (resetTimeout elapsed
 *        │                                since last failure)
 *  (halfOpenProbeCount                             │
 *   consecutive successes)                         v
 *        └─────────────────────────────────── HALF_OPEN
 *                                                  │
 *                                   (any failure) ─┴──> OPEN
 * </pre>
 *
 * <p>The breaker only decides and keeps books: it never executes the guarded call,
 * never blocks and never throws. Callers ask {@link #allowRequest()} before each
 * primary attempt and report the outcome through {@link #recordSuccess()} or
 * {@link #recordFailure()}. Every read-decide-mutate sequence runs under a single
 * lock, so concurrent callers cannot trip or close the circuit twice.</p>
 *
 * <p>Listeners are notified after the lock is released.</p>
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final int halfOpenProbeCount;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int probesAdmitted;
    private int probeSuccesses;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.failureThreshold = config.getFailureThreshold();
        this.resetTimeout = config.getResetTimeout();
        this.halfOpenProbeCount = config.getHalfOpenProbeCount();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Decides whether the next primary store call may proceed.
     * An open circuit whose reset timeout has elapsed moves to half-open here and
     * admits the caller as the first probe.
     */
    public boolean allowRequest() {
        Transition transition = null;
        boolean allowed;

        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitBreakerState.OPEN) {
                if (lastFailureTime != null && Duration.between(lastFailureTime, now).compareTo(resetTimeout) > 0) {
                    transition = transitionTo(CircuitBreakerState.HALF_OPEN, now);
                    probesAdmitted = 0;
                    probeSuccesses = 0;
                } else {
                    return false;
                }
            }

            if (state == CircuitBreakerState.HALF_OPEN) {
                allowed = probesAdmitted < halfOpenProbeCount;
                if (allowed) {
                    probesAdmitted++;
                }
            } else {
                allowed = true;
            }
        } finally {
            lock.unlock();
        }

        notifyListeners(transition);
        return allowed;
    }

    public void recordSuccess() {
        Transition transition = null;

        lock.lock();
        try {
            switch (state) {
                case CLOSED -> failureCount = 0;
                case HALF_OPEN -> {
                    probeSuccesses++;
                    if (probeSuccesses >= halfOpenProbeCount) {
                        transition = transitionTo(CircuitBreakerState.CLOSED, clock.instant());
                        clearCounters();
                    }
                }
                case OPEN -> {
                    // a call admitted before the circuit opened; it does not close the circuit
                }
            }
        } finally {
            lock.unlock();
        }

        notifyListeners(transition);
    }

    public void recordFailure() {
        Transition transition = null;

        lock.lock();
        try {
            Instant now = clock.instant();
            failureCount++;
            lastFailureTime = now;

            if (state == CircuitBreakerState.HALF_OPEN) {
                transition = transitionTo(CircuitBreakerState.OPEN, now);
                probesAdmitted = 0;
                probeSuccesses = 0;
            } else if (state == CircuitBreakerState.CLOSED && failureCount >= failureThreshold) {
                transition = transitionTo(CircuitBreakerState.OPEN, now);
            }
        } finally {
            lock.unlock();
        }

        notifyListeners(transition);
    }

    /**
     * Forces the circuit closed and zeroes all counters. The last failure time is
     * kept for reporting.
     */
    public void reset() {
        Transition transition = null;

        lock.lock();
        try {
            if (state != CircuitBreakerState.CLOSED) {
                transition = transitionTo(CircuitBreakerState.CLOSED, clock.instant());
            }
            clearCounters();
        } finally {
            lock.unlock();
        }

        logger.info("Circuit breaker {} has been reset", name);
        notifyListeners(transition);
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public void addListener(CircuitStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(CircuitStateListener listener) {
        listeners.remove(listener);
    }

    private Transition transitionTo(CircuitBreakerState next, Instant at) {
        CircuitBreakerState previous = state;
        state = next;
        return new Transition(previous, next, at, failureCount);
    }

    private void clearCounters() {
        failureCount = 0;
        probesAdmitted = 0;
        probeSuccesses = 0;
    }

    private void notifyListeners(Transition transition) {
        if (transition == null) {
            return;
        }

        if (transition.to() == CircuitBreakerState.OPEN) {
            if (transition.from() == CircuitBreakerState.HALF_OPEN) {
                logger.warn("Circuit breaker {} reopened - primary store still failing", name);
            } else {
                logger.warn("Circuit breaker {} opened after {} consecutive failures", name, transition.failures());
            }
        } else if (transition.to() == CircuitBreakerState.CLOSED) {
            logger.info("Circuit breaker {} closed - primary store recovered", name);
        } else {
            logger.info("Circuit breaker {} half-open - admitting up to {} probes", name, halfOpenProbeCount);
        }

        for (CircuitStateListener listener : listeners) {
            try {
                listener.onStateTransition(transition.from(), transition.to(), transition.at());
            } catch (RuntimeException e) {
                logger.error("Circuit state listener failed for {} -> {}", transition.from(), transition.to(), e);
            }
        }
    }

    private record Transition(CircuitBreakerState from, CircuitBreakerState to, Instant at, int failures) {
    }
}
