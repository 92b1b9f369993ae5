package in.indicatorhub.infrastructure.provider.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Time-based circuit breaker for the indicator provider.
 *
 * Features:
 * - Weighted failure score (auth failures count double)
 * - Opens once the score reaches the configured maximum
 * - Closes automatically once the reset window has elapsed (no probe state)
 * - Successes decay the score multiplicatively instead of zeroing it
 * - Listener notified on every state change
 *
 * Usage:
 * <pre>
 * CircuitBreaker breaker = CircuitBreaker.builder()
 *     .maxConsecutiveErrors(3)
 *     .resetWindow(Duration.ofMinutes(5))
 *     .decayFactor(0.5)
 *     .build();
 *
 * if (!breaker.isOpen()) {
 *     try {
 *         call();
 *         breaker.recordSuccess();
 *     } catch (Exception e) {
 *         if (breaker.recordFailure(1.0)) {
 *             drainEverything();
 *         }
 *     }
 * }
 * </pre>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN
    }

    private final int maxConsecutiveErrors;
    private final Duration resetWindow;
    private final double decayFactor;
    private final Clock clock;

    private State state = State.CLOSED;
    private double errorScore = 0.0;
    private Instant reopenAt;
    private volatile Consumer<State> stateListener;

    private CircuitBreaker(int maxConsecutiveErrors, Duration resetWindow, double decayFactor, Clock clock) {
        this.maxConsecutiveErrors = maxConsecutiveErrors;
        this.resetWindow = resetWindow;
        this.decayFactor = decayFactor;
        this.clock = clock;
    }

    /**
     * Check whether calls are currently blocked.
     * Closes the breaker as a side effect once the reset window has passed.
     *
     * @return true if open
     */
    public boolean isOpen() {
        boolean closedNow;
        synchronized (this) {
            if (state == State.CLOSED) {
                return false;
            }
            if (clock.instant().isBefore(reopenAt)) {
                return true;
            }
            closedNow = transition(State.CLOSED);
        }
        if (closedNow) {
            notifyListener(State.CLOSED);
        }
        return false;
    }

    /**
     * Record a failed provider call.
     *
     * @param weight how much this failure counts toward opening (0 ignores it)
     * @return true if this failure opened the breaker
     */
    public boolean recordFailure(double weight) {
        if (weight <= 0) {
            return false;
        }
        boolean opened = false;
        synchronized (this) {
            if (state == State.OPEN) {
                return false;
            }
            errorScore += weight;
            log.debug("[CircuitBreaker] Failure recorded (weight={}, score={}/{})",
                weight, errorScore, maxConsecutiveErrors);
            if (errorScore >= maxConsecutiveErrors) {
                opened = transition(State.OPEN);
            }
        }
        if (opened) {
            notifyListener(State.OPEN);
        }
        return opened;
    }

    /**
     * Record a successful provider call. Decays the error score toward zero.
     */
    public synchronized void recordSuccess() {
        if (state == State.OPEN) {
            return;
        }
        errorScore *= decayFactor;
        if (errorScore < 1.0) {
            errorScore = 0.0;
        }
    }

    /**
     * Force the breaker closed and clear the error score (operator reset).
     */
    public void reset() {
        boolean closedNow;
        synchronized (this) {
            closedNow = transition(State.CLOSED);
            errorScore = 0.0;
        }
        if (closedNow) {
            notifyListener(State.CLOSED);
        }
    }

    /**
     * Single transition function for the breaker state machine.
     * Caller must hold the monitor.
     */
    private boolean transition(State target) {
        if (state == target) {
            return false;
        }
        state = target;
        if (target == State.OPEN) {
            reopenAt = clock.instant().plus(resetWindow);
            log.error("[CircuitBreaker] OPENED after error score {} (reopens at {})", errorScore, reopenAt);
        } else {
            errorScore = 0.0;
            reopenAt = null;
            log.info("[CircuitBreaker] CLOSED");
        }
        return true;
    }

    private void notifyListener(State newState) {
        Consumer<State> listener = stateListener;
        if (listener == null) {
            return;
        }
        try {
            listener.accept(newState);
        } catch (Exception e) {
            log.error("[CircuitBreaker] State listener failed: {}", e.getMessage(), e);
        }
    }

    public void onStateChange(Consumer<State> listener) {
        this.stateListener = listener;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getConsecutiveErrors() {
        return (int) Math.floor(errorScore);
    }

    public synchronized double getErrorScore() {
        return errorScore;
    }

    /**
     * @return reopen time, or null while closed
     */
    public synchronized Instant getReopenAt() {
        return reopenAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default breaker for the indicator provider: 3 errors, 5 minute cool-down.
     */
    public static CircuitBreaker forIndicatorProvider() {
        return builder().build();
    }

    /**
     * Builder for CircuitBreaker.
     */
    public static class Builder {
        private int maxConsecutiveErrors = 3;
        private Duration resetWindow = Duration.ofMinutes(5);
        private double decayFactor = 0.5;
        private Clock clock = Clock.systemUTC();

        public Builder maxConsecutiveErrors(int maxConsecutiveErrors) {
            if (maxConsecutiveErrors <= 0) {
                throw new IllegalArgumentException("Max consecutive errors must be positive");
            }
            this.maxConsecutiveErrors = maxConsecutiveErrors;
            return this;
        }

        public Builder resetWindow(Duration resetWindow) {
            if (resetWindow.isNegative() || resetWindow.isZero()) {
                throw new IllegalArgumentException("Reset window must be positive");
            }
            this.resetWindow = resetWindow;
            return this;
        }

        public Builder decayFactor(double decayFactor) {
            if (decayFactor < 0.0 || decayFactor >= 1.0) {
                throw new IllegalArgumentException("Decay factor must be in [0, 1)");
            }
            this.decayFactor = decayFactor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(maxConsecutiveErrors, resetWindow, decayFactor, clock);
        }
    }
}
